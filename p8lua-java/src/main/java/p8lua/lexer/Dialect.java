package p8lua.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The grammar extensions enabled for a cartridge version tag.
 *
 * <p>Every version accepts the console's basic additions to Lua ({@code !=}, the
 * arithmetic compound assignments, labels and the one-line {@code if}/{@code while}).
 * From {@link #EXTENDED_VERSION} on, the bitwise and shift operator family, integer
 * division, the peek operators, {@code //} comments and the {@code ?} print shorthand
 * are recognized as well.
 */
public record Dialect(int version) {

    public static final int DEFAULT_VERSION = 8;
    public static final int EXTENDED_VERSION = 8;

    public static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for",
            "function", "goto", "if", "in", "local", "nil", "not", "or",
            "repeat", "return", "then", "true", "until", "while");

    // Longest first: a symbol must be tried before any of its prefixes.
    private static final List<String> BASE_SYMBOLS = List.of(
            "...",
            "==", "~=", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "..",
            "+", "-", "*", "/", "%", "^", "#", "<", ">", "=",
            "(", ")", "{", "}", "[", "]", ";", ":", ",", ".");

    private static final List<String> EXTENDED_SYMBOLS = List.of(
            ">>>=", "<<>=", ">><=",
            ">>>", "<<>", ">><", "^^=", "<<=", ">>=", "..=",
            "^=", "\\=", "&=", "|=", "^^", "<<", ">>",
            "&", "|", "~", "\\", "@", "$");

    public static Dialect defaultDialect() {
        return new Dialect(DEFAULT_VERSION);
    }

    public static Dialect forVersion(int version) {
        return new Dialect(version);
    }

    public boolean extended() {
        return version >= EXTENDED_VERSION;
    }

    public boolean slashComments() {
        return extended();
    }

    public boolean printShorthand() {
        return extended();
    }

    /** Symbols recognized by this dialect, longest first. */
    public List<String> symbols() {
        List<String> all = new ArrayList<>();
        if (extended()) all.addAll(EXTENDED_SYMBOLS);
        all.addAll(BASE_SYMBOLS);
        all.sort((a, b) -> b.length() - a.length());
        return all;
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }
}
