package p8lua;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import p8lua.ast.stmt.CallStmt;
import p8lua.ast.stmt.Stmt;
import p8lua.lexer.LexerException;
import p8lua.parser.ParserException;
import p8lua.writer.FormatterWriter;
import p8lua.writer.MinifyWriter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LuaSourceTest {

    @Test
    void counts_for_simple_assignment() {
        LuaSource s = LuaSource.fromString("a=1\n");
        assertEquals(3, s.tokenCount());
        assertEquals(4, s.charCount());
        assertEquals(1, s.lineCount());
    }

    @Test
    void comments_are_not_tokens() {
        LuaSource s = LuaSource.fromString("-- comment\n");
        assertEquals(0, s.tokenCount());
        assertEquals(11, s.charCount());
    }

    @Test
    void empty_source() {
        LuaSource s = LuaSource.fromString("");
        assertEquals(0, s.tokenCount());
        assertEquals(0, s.charCount());
        assertEquals(0, s.lineCount());
        assertTrue(s.root().statements().isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "a = 1                                    | 3",
            "a = -123                                 | 3",
            "a = b - 1                                | 5",
            "a = (b) - 1                              | 6",
            "a = 123.45e2                             | 4",
            "a = 0xe                                  | 3",
            "c:m()                                    | 3",
            "a = {[a]=3;b=4,999}                      | 11",
            "local x = 1                              | 3",
            "function t() print('hi') end t()         | 8",
            "if not x then y.z = -1 end               | 8"
    })
    void platform_token_count(String src, int expected) {
        assertEquals(expected, LuaSource.fromString(src.trim()).platformTokenCount());
    }

    @Test
    void title_and_byline() {
        LuaSource s = LuaSource.fromString("-- space cat\n-- by someone\nx = 1\n");
        assertEquals("space cat", s.title());
        assertEquals("by someone", s.byline());
    }

    @Test
    void missing_title_and_byline() {
        LuaSource s = LuaSource.fromString("x = 1 -- not a title\n");
        assertNull(s.title());
        assertNull(s.byline());
        assertNull(LuaSource.fromString("").title());
    }

    @Test
    void lines_may_split_anywhere() {
        LuaSource s = LuaSource.fromLines(List.of("x = \"a", "b\" y", " = [[", "]]"));
        assertEquals(6, s.tokenCount());
        assertEquals(2, s.root().statements().size());
    }

    @Test
    void bytes_are_read_one_char_each() {
        byte[] line = "x = \"\u0080\"\n".getBytes(StandardCharsets.ISO_8859_1);
        LuaSource s = LuaSource.fromBytes(List.of(line), 8);
        assertEquals(line.length, s.charCount());
    }

    @Test
    void errors_propagate() {
        assertThrows(LexerException.class, () -> LuaSource.fromString("x = \"open"));
        assertThrows(ParserException.class, () -> LuaSource.fromString("x = "));
    }

    @Test
    void with_root_reparses_changed_tree() {
        LuaSource s = LuaSource.fromString("a = 1\nprint(a)\nb = 2\n");
        List<Stmt> kept = new ArrayList<>();
        for (Stmt st : s.root().statements()) {
            if (!(st instanceof CallStmt)) kept.add(st);
        }
        LuaSource changed = s.withRoot(s.root().withStatements(kept));

        assertEquals("a = 1\nb = 2\n", changed.toLines().reduce("", String::concat));
        assertEquals(2, changed.lineCount());
        assertEquals(2, changed.root().statements().size());
        assertEquals(s.version(), changed.version());
    }

    @Test
    void reparse_with_writer() {
        LuaSource s = LuaSource.fromString("local long_name = 1 print(long_name)");
        LuaSource small = s.reparse(new MinifyWriter());
        assertTrue(small.charCount() < s.charCount());
        assertEquals(s.tokenCount(), small.tokenCount());

        LuaSource pretty = LuaSource.fromString("x=1").reparse(new FormatterWriter(2));
        assertEquals("x = 1", pretty.toLines().reduce("", String::concat));
    }

    @Test
    void rendering_does_not_change_source() {
        LuaSource s = LuaSource.fromString("x=1\n");
        s.toLines(new FormatterWriter(4)).forEach(l -> { });
        assertEquals("x=1\n", s.toLines().reduce("", String::concat));
    }
}
