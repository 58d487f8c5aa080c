package p8lua.parser;

import org.junit.jupiter.api.Test;
import p8lua.ast.Lexeme;
import p8lua.lexer.Lexer;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TokenBufferTest {

    private static TokenBuffer buffer(String src) {
        return new TokenBuffer(Lexer.tokenize(src));
    }

    @Test
    void accept_collects_preceding_trivia() {
        TokenBuffer b = buffer("  -- c\n x");
        Lexeme x = b.accept(TokenKind.NAME);
        assertNotNull(x);
        assertEquals("x", x.text());
        assertEquals(List.of(TokenKind.SPACE, TokenKind.COMMENT, TokenKind.NEWLINE, TokenKind.SPACE),
                x.trivia().stream().map(Token::kind).toList());
        assertTrue(b.atEnd());
    }

    @Test
    void failed_accept_leaves_cursor() {
        TokenBuffer b = buffer(" x");
        assertNull(b.accept(Token.keyword("end")));
        assertEquals(TokenKind.SPACE, b.peek().kind());
        assertEquals("x", b.peekSignificant().text());
    }

    @Test
    void rewind_returns_to_innermost_mark() {
        TokenBuffer b = buffer("a b c");
        b.accept(TokenKind.NAME);
        b.mark();
        b.accept(TokenKind.NAME);
        b.mark();
        b.accept(TokenKind.NAME);
        b.rewind();
        assertEquals("c", b.peekSignificant().text());
        b.release();
        b.rewind();
        assertEquals("b", b.peekSignificant().text());
        b.release();
    }

    @Test
    void rewind_without_mark_goes_to_last_advance() {
        TokenBuffer b = buffer("a b c");
        b.accept(TokenKind.NAME);
        b.advance();
        b.accept(TokenKind.NAME);
        b.accept(TokenKind.NAME);
        b.rewind();
        assertEquals("b", b.peekSignificant().text());
    }

    @Test
    void advance_with_open_mark_fails() {
        TokenBuffer b = buffer("a");
        b.mark();
        assertThrows(IllegalStateException.class, b::advance);
    }

    @Test
    void release_without_mark_fails() {
        assertThrows(IllegalStateException.class, () -> buffer("a").release());
    }

    @Test
    void advance_drops_consumed_tokens() {
        TokenBuffer b = buffer("a b c d");
        b.accept(TokenKind.NAME);
        b.accept(TokenKind.NAME);
        b.peekSignificant();
        int before = b.buffered();
        b.advance();
        assertTrue(b.buffered() < before);
        assertEquals("c", b.accept(TokenKind.NAME).text());
    }

    @Test
    void source_is_pulled_lazily() {
        List<Token> tokens = Lexer.tokenize("a b c d e f");
        AtomicInteger pulled = new AtomicInteger();
        Iterator<Token> it = tokens.iterator();
        TokenBuffer b = new TokenBuffer(new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Token next() {
                pulled.incrementAndGet();
                return it.next();
            }
        });
        b.accept(TokenKind.NAME);
        assertEquals(1, pulled.get());
        b.peekSignificant();
        assertEquals(3, pulled.get());
    }

    @Test
    void trailing_trivia_consumes_to_end() {
        TokenBuffer b = buffer("x -- done\n");
        b.accept(TokenKind.NAME);
        assertEquals(3, b.trailingTrivia().size());
        assertNull(b.peek());
    }

    @Test
    void line_limit_hides_later_lines() {
        TokenBuffer b = buffer("a b\nc");
        int outer = b.limitToLine(1);
        assertEquals("a", b.accept(TokenKind.NAME).text());
        assertEquals("b", b.accept(TokenKind.NAME).text());
        assertTrue(b.atEnd());
        assertNull(b.accept(TokenKind.NAME));
        assertEquals("c", b.peekPastLimit().text());
        b.restoreLineLimit(outer);
        assertEquals("c", b.accept(TokenKind.NAME).text());
    }

    @Test
    void nested_line_limits_keep_the_tighter_one() {
        TokenBuffer b = buffer("a\nb\nc");
        int outer = b.limitToLine(2);
        int inner = b.limitToLine(5);
        b.accept(TokenKind.NAME);
        b.accept(TokenKind.NAME);
        assertTrue(b.atEnd());
        b.restoreLineLimit(inner);
        assertTrue(b.atEnd());
        b.restoreLineLimit(outer);
        assertFalse(b.atEnd());
    }
}
