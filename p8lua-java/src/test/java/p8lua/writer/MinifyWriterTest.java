package p8lua.writer;

import org.junit.jupiter.api.Test;
import p8lua.LuaSource;
import p8lua.lexer.Dialect;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.HashSet;
import java.util.Set;
import java.util.StringJoiner;

import static org.junit.jupiter.api.Assertions.*;

class MinifyWriterTest {

    private static String minify(String src) {
        return LuaSource.fromString(src).toLines(new MinifyWriter()).reduce("", String::concat);
    }

    @Test
    void drops_comments_and_whitespace() {
        assertEquals("local a=1 print(a)", minify("-- hi\nlocal foo = 1\n\nprint(foo) -- out\n"));
    }

    @Test
    void keeps_globals_and_fields() {
        assertEquals("score=0 player={speed=2}player.speed+=score",
                minify("score = 0\nplayer = { speed = 2 }\nplayer.speed += score\n"));
    }

    @Test
    void locals_avoid_global_names() {
        assertEquals("a=1 local b=a", minify("a = 1 local x = a"));
    }

    @Test
    void disjoint_scopes_reuse_names() {
        assertEquals("do local a=1 end do local a=2 end", minify("do local x = 1 end do local y = 2 end"));
    }

    @Test
    void nested_scopes_get_distinct_names() {
        assertEquals("local function a(b,c)local d=b+c return d end",
                minify("local function add(x, y) local sum = x + y return sum end"));
    }

    @Test
    void shadowing_follows_scopes() {
        assertEquals("local a=1 do local b=2 print(b)end print(a)",
                minify("local x = 1 do local x = 2 print(x) end print(x)"));
    }

    @Test
    void separates_operators_that_would_merge() {
        assertEquals("x=a- -b", minify("x = a - -b"));
    }

    @Test
    void statement_starting_with_paren_gets_semicolon() {
        assertEquals("a=1;(f)()", minify("a = 1\n(f)()"));
    }

    @Test
    void line_terminated_forms_end_with_newline() {
        assertEquals("if(a)b=1\nc=2", minify("if (a) b = 1\nc = 2"));
        assertEquals("?1\n?2", minify("?1\n?2"));
    }

    @Test
    void one_line_if_body_stops_at_line_end() {
        assertEquals("function f()if(x)return\nspr(1)end",
                minify("function f()\nif (x) return\nspr(1)\nend\n"));
    }

    @Test
    void number_before_concat_keeps_space() {
        assertEquals("a=1 ..b", minify("a = 1 .. b\n"));
    }

    @Test
    void is_deterministic() {
        String src = "local a, b = 1, 2 function f(x) local y = x return y end";
        assertEquals(minify(src), minify(src));
    }

    @Test
    void many_locals_never_become_keywords() {
        StringJoiner names = new StringJoiner(", ");
        for (int i = 0; i < 300; i++) names.add("v" + i);
        String out = minify("local " + names + " = 1");

        Set<String> declared = new HashSet<>();
        for (Token t : LuaSource.fromString(out).tokens()) {
            if (t.is(TokenKind.NAME)) declared.add(t.text());
            if (t.is(TokenKind.NAME)) assertFalse(Dialect.isKeyword(t.text()));
        }
        assertEquals(300, declared.size());
    }

    @Test
    void output_parses_back() {
        String src = """
                -- game
                local p = {x = 64, y = 64}
                function _update()
                  if (btn(0)) p.x -= 1
                  if (btn(1)) p.x += 1
                  for i, v in pairs(p) do
                    local tmp = v * 2
                    p[i] = tmp // 2
                  end
                end
                function _draw()
                  cls() circfill(p.x, p.y, 4, 8)
                  ?"score: " .. #p
                end
                """;
        LuaSource minified = LuaSource.fromString(src).reparse(new MinifyWriter());
        assertEquals(LuaSource.fromString(src).root().statements().size(), minified.root().statements().size());
        assertTrue(minified.charCount() < src.length());
        assertEquals(0, minified.tokens().stream().filter(t -> t.is(TokenKind.COMMENT)).count());
    }
}
