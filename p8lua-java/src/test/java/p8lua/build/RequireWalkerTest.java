package p8lua.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import p8lua.LuaSource;
import p8lua.walker.AstWalker;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequireWalkerTest {

    private static List<RequireCall> requires(String src) {
        return AstWalker.collect(LuaSource.fromString(src).root(), new RequireWalker());
    }

    @Test
    void collects_includes_in_order() {
        var calls = requires("""
                require("a")
                local b = require 'b'
                function f() require("c", {use_game_loop=true}) end
                """);
        assertEquals(List.of("a", "b", "c"), calls.stream().map(RequireCall::path).toList());
        assertFalse(calls.get(0).useGameLoop());
        assertTrue(calls.get(2).useGameLoop());
        assertEquals(3, calls.get(2).token().line());
    }

    @Test
    void method_and_field_calls_are_ignored() {
        assertTrue(requires("m:require('x') m.require('y')").isEmpty());
    }

    @Test
    void game_loop_can_be_turned_off_explicitly() {
        assertFalse(requires("require('a', {use_game_loop=false})").get(0).useGameLoop());
    }

    @Test
    void wrong_arity() {
        var ex = assertThrows(ModuleBuildException.class, () -> requires("x = 1\nrequire()"));
        assertEquals("require() has 0 args, should have 1 or 2 at line 2 char 1", ex.getMessage());
    }

    @Test
    void first_argument_must_be_a_literal() {
        var ex = assertThrows(ModuleBuildException.class, () -> requires("require(name)"));
        assertEquals("require() first argument must be a string literal", ex.msg());
    }

    @Test
    void second_argument_must_be_a_table() {
        var ex = assertThrows(ModuleBuildException.class, () -> requires("require('a', true)"));
        assertEquals("require() second argument must be a table literal", ex.msg());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "require('a', {})",
            "require('a', {use_game_loop=1})",
            "require('a', {game_loop=true})",
            "require('a', {use_game_loop=true, x=1})"
    })
    void bad_options(String src) {
        var ex = assertThrows(ModuleBuildException.class, () -> requires(src));
        assertEquals("Invalid require() options; did you mean {use_game_loop=true} ?", ex.msg());
    }
}
