package p8lua.parser;

import p8lua.ast.Lexeme;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * A cursor over a pulled token stream with checkpoints for backtracking.
 *
 * <p>Tokens are read from the source only as far as lookahead requires. The base
 * checkpoint is moved by {@link #advance()}, which also drops every buffered token
 * behind it; nested checkpoints ({@link #mark()}) let a production try an alternative
 * and {@link #rewind()} when it fails. The cursor never moves behind the innermost
 * checkpoint.
 */
public final class TokenBuffer {
    private final Iterator<Token> source;
    private final List<Token> buffer = new ArrayList<>();
    private final Deque<Integer> marks = new ArrayDeque<>();

    // absolute stream indices
    private int base = 0;
    private int checkpoint = 0;
    private int cursor = 0;

    // significant tokens starting after this line read as end of input
    private int lineLimit = Integer.MAX_VALUE;

    public TokenBuffer(Iterator<Token> source) {
        this.source = source;
    }

    public TokenBuffer(List<Token> tokens) {
        this(tokens.iterator());
    }

    // ---------- lookahead ----------

    /** The token at the cursor, trivia included, or null at end of input. */
    public Token peek() {
        return at(cursor);
    }

    /** The next non-trivia token, or null at end of input. Does not move the cursor. */
    public Token peekSignificant() {
        Token t = peekPastLimit();
        return hidden(t) ? null : t;
    }

    /** The next non-trivia token, ignoring any line limit. */
    public Token peekPastLimit() {
        int i = cursor;
        Token t;
        while ((t = at(i)) != null && t.isTrivia()) i++;
        return t;
    }

    public boolean atEnd() {
        return peekSignificant() == null;
    }

    // ---------- consuming ----------

    /**
     * Consumes the next significant token if it has the given kind.
     *
     * @return the token with the trivia skipped on the way, or null with the cursor unchanged
     */
    public Lexeme accept(TokenKind kind) {
        return acceptIf(t -> t.matches(kind));
    }

    /** Consumes the next significant token if it equals {@code expected} (kind and value). */
    public Lexeme accept(Token expected) {
        return acceptIf(t -> t.matches(expected));
    }

    private Lexeme acceptIf(Predicate<Token> test) {
        int i = cursor;
        List<Token> trivia = new ArrayList<>();
        Token t;
        while ((t = at(i)) != null && t.isTrivia()) {
            trivia.add(t);
            i++;
        }
        if (t == null || hidden(t) || !test.test(t)) return null;
        cursor = i + 1;
        return new Lexeme(t, trivia);
    }

    /** Consumes the trivia left before the end of input. */
    public List<Token> trailingTrivia() {
        List<Token> trivia = new ArrayList<>();
        Token t;
        while ((t = at(cursor)) != null && t.isTrivia()) {
            trivia.add(t);
            cursor++;
        }
        return trivia;
    }

    // ---------- line limit ----------

    /**
     * Makes significant tokens that start after {@code line} invisible, as if the input
     * ended there. Limits nest: the tighter one wins.
     *
     * @return the previous limit, to hand back to {@link #restoreLineLimit(int)}
     */
    public int limitToLine(int line) {
        int previous = lineLimit;
        lineLimit = Math.min(lineLimit, line);
        return previous;
    }

    public void restoreLineLimit(int previous) {
        lineLimit = previous;
    }

    private boolean hidden(Token t) {
        return t != null && t.line() > lineLimit;
    }

    // ---------- checkpoints ----------

    /** Pushes a checkpoint at the cursor. */
    public void mark() {
        marks.push(cursor);
    }

    /** Moves the cursor back to the innermost checkpoint. */
    public void rewind() {
        cursor = marks.isEmpty() ? checkpoint : marks.peek();
    }

    /** Pops the innermost checkpoint, keeping the cursor where it is. */
    public void release() {
        if (marks.isEmpty()) throw new IllegalStateException("No checkpoint to release");
        marks.pop();
    }

    /**
     * Commits everything consumed so far: the base checkpoint moves to the cursor and
     * the tokens behind it are discarded.
     *
     * @throws IllegalStateException while a nested checkpoint is outstanding
     */
    public void advance() {
        if (!marks.isEmpty()) {
            throw new IllegalStateException("Cannot advance with " + marks.size() + " open checkpoint(s)");
        }
        checkpoint = cursor;
        int drop = Math.min(cursor - base, buffer.size());
        buffer.subList(0, drop).clear();
        base += drop;
    }

    /** Number of tokens held in memory, for tests. */
    int buffered() {
        return buffer.size();
    }

    private Token at(int index) {
        while (index - base >= buffer.size()) {
            if (!source.hasNext()) return null;
            buffer.add(source.next());
        }
        return buffer.get(index - base);
    }
}
