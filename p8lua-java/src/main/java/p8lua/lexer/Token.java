package p8lua.lexer;

import java.util.Locale;
import java.util.Objects;

/**
 * A lexical unit: its kind, the exact source spelling, a normalized value and the
 * 1-based position of its first character.
 *
 * <p>Two tokens are equal when they have the same kind and value; positions are
 * ignored. Keywords compare case-insensitively. For strings the value is the decoded
 * contents, so {@code 'a'} equals {@code "a"}; for labels it is the bare name. Every
 * other kind uses its spelling as value, which keeps numbers in their original form.
 */
public record Token(TokenKind kind, String text, String value, int line, int column) {

    public enum QuoteStyle {
        DOUBLE, SINGLE, LONG_BRACKET
    }

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(value, "value");
    }

    public Token(TokenKind kind, String text, int line, int column) {
        this(kind, text, text, line, column);
    }

    // ---------- patterns and generated tokens ----------

    public static Token keyword(String word) {
        return synthetic(TokenKind.KEYWORD, word);
    }

    public static Token symbol(String sym) {
        return synthetic(TokenKind.SYMBOL, sym);
    }

    public static Token name(String name) {
        return synthetic(TokenKind.NAME, name);
    }

    public static Token number(String spelling) {
        return synthetic(TokenKind.NUMBER, spelling);
    }

    /** A double-quoted string token for {@code contents}, escaped as needed. */
    public static Token string(String contents) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < contents.length(); i++) {
            char c = contents.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return new Token(TokenKind.STRING, sb.toString(), contents, 0, 0);
    }

    public static Token synthetic(TokenKind kind, String text) {
        return new Token(kind, text, text, 0, 0);
    }

    // ---------- queries ----------

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    /** Generated tokens have no source position. */
    public boolean isSynthetic() {
        return line <= 0;
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    /** Length of the raw spelling, which is what the platform's character limit counts. */
    public int length() {
        return text.length();
    }

    /**
     * Matches either a kind or an exact token value; the parser uses both forms.
     */
    public boolean matches(TokenKind k) {
        return kind == k;
    }

    public boolean matches(Token other) {
        return equals(other);
    }

    public QuoteStyle quoteStyle() {
        if (kind != TokenKind.STRING || text.isEmpty()) return null;
        return switch (text.charAt(0)) {
            case '"' -> QuoteStyle.DOUBLE;
            case '\'' -> QuoteStyle.SINGLE;
            default -> QuoteStyle.LONG_BRACKET;
        };
    }

    /** Number of {@code =} signs in a long-bracket string, or -1 for quoted strings. */
    public int bracketLevel() {
        if (quoteStyle() != QuoteStyle.LONG_BRACKET) return -1;
        int level = 0;
        while (text.charAt(1 + level) == '=') level++;
        return level;
    }

    private String normalizedValue() {
        return kind == TokenKind.KEYWORD ? value.toLowerCase(Locale.ROOT) : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return kind == other.kind && normalizedValue().equals(other.normalizedValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, normalizedValue());
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
