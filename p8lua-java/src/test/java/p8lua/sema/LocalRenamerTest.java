package p8lua.sema;

import org.junit.jupiter.api.Test;
import p8lua.LuaSource;
import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.stmt.LocalAssignStmt;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalRenamerTest {

    private static Chunk parse(String src) {
        return LuaSource.fromString(src).root();
    }

    @Test
    void globals_are_collected() {
        Chunk root = parse("""
                local x = y
                function draw() z = x + w end
                t.field = 1
                """);
        assertEquals(Set.of("y", "draw", "z", "w", "t"), LocalRenamer.globalNames(root));
    }

    @Test
    void initializer_sees_outer_name() {
        // the right-hand x is the global, not the new local
        Chunk root = parse("local x = x");
        assertEquals(Set.of("x"), LocalRenamer.globalNames(root));
        Map<Lexeme, String> renames = LocalRenamer.rename(root);
        var local = (LocalAssignStmt) root.statements().get(0);
        assertEquals("a", renames.get(local.names().names().get(0)));
        assertEquals(1, renames.size());
    }

    @Test
    void repeat_condition_sees_body_locals() {
        Chunk root = parse("repeat local done = true until done");
        assertTrue(LocalRenamer.globalNames(root).isEmpty());
        assertEquals(2, LocalRenamer.rename(root).size());
    }

    @Test
    void keywords_are_never_generated() {
        StringBuilder src = new StringBuilder("local ");
        for (int i = 0; i < 26 * 26 + 26; i++) {
            if (i > 0) src.append(',');
            src.append("v").append(i);
        }
        Map<Lexeme, String> renames = LocalRenamer.rename(parse(src.toString()));
        assertEquals(26 * 26 + 26, Set.copyOf(renames.values()).size());
        assertFalse(renames.containsValue("do"));
        assertFalse(renames.containsValue("if"));
        assertFalse(renames.containsValue("in"));
        assertFalse(renames.containsValue("or"));
    }

    @Test
    void for_loop_variables_are_scoped_to_the_loop() {
        Map<Lexeme, String> renames = LocalRenamer.rename(parse("for i = 1, 3 do end for k, v in pairs(t) do end"));
        assertEquals(Set.of("a", "b"), Set.copyOf(renames.values()));
    }
}
