package p8lua.lexer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-at-a-time tokenizer.
 *
 * <p>The lexer keeps the state of an open string, multiline string or multiline comment
 * between calls to {@link #processLine(String)}, so a source can be fed in arbitrary
 * chunks. Whitespace, newlines and comments are emitted as tokens too: together with
 * the significant tokens they reproduce the input exactly.
 *
 * <p>Source bytes are handled as ISO-8859-1 characters, one char per byte, so the
 * platform's glyph bytes above 0x7f pass through untouched.
 */
public final class Lexer {

    private enum State { NONE, IN_STRING, IN_MULTILINE_COMMENT, IN_MULTILINE_STRING }

    private static final Pattern HEX_NUMBER =
            Pattern.compile("0[xX](?:[0-9a-fA-F]+(?:\\.(?!\\.)[0-9a-fA-F]*)?|\\.[0-9a-fA-F]+)");
    private static final Pattern BIN_NUMBER =
            Pattern.compile("0[bB](?:[01]+(?:\\.(?!\\.)[01]*)?|\\.[01]+)");
    private static final Pattern DEC_NUMBER =
            Pattern.compile("(?:[0-9]+(?:\\.(?!\\.)[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
    private static final Pattern LABEL =
            Pattern.compile("::([A-Za-z_\\x80-\\xff][A-Za-z0-9_\\x80-\\xff]*)::");

    private static final Map<Character, Character> STRING_ESCAPES = Map.ofEntries(
            Map.entry('\n', '\n'),
            Map.entry('a', (char) 7),
            Map.entry('b', '\b'),
            Map.entry('f', '\f'),
            Map.entry('n', '\n'),
            Map.entry('r', '\r'),
            Map.entry('t', '\t'),
            Map.entry('v', (char) 11),
            Map.entry('\\', '\\'),
            Map.entry('"', '"'),
            Map.entry('\'', '\'')
    );

    private final Dialect dialect;
    private final List<String> symbols;
    private final List<Token> tokens = new ArrayList<>();

    // position of the next unconsumed char, 1-based
    private int line = 1;
    private int col = 1;

    // open string / multiline state
    private State state = State.NONE;
    private int openLine;
    private int openCol;
    private char stringDelim;
    private int bracketLevel;
    private final StringBuilder raw = new StringBuilder();
    private final StringBuilder value = new StringBuilder();

    public Lexer(Dialect dialect) {
        this.dialect = dialect;
        this.symbols = dialect.symbols();
    }

    public Lexer(int version) {
        this(Dialect.forVersion(version));
    }

    public Lexer() {
        this(Dialect.defaultDialect());
    }

    /** Tokenizes a complete source. */
    public static List<Token> tokenize(String source, Dialect dialect) {
        Lexer lexer = new Lexer(dialect);
        lexer.processLine(source);
        lexer.finish();
        return lexer.tokens();
    }

    public static List<Token> tokenize(String source) {
        return tokenize(source, Dialect.defaultDialect());
    }

    /**
     * Processes every line, then checks that no string or comment is left open.
     *
     * @return the tokens
     */
    public List<Token> process(Iterable<String> lines) {
        for (String l : lines) processLine(l);
        finish();
        return tokens();
    }

    public List<Token> processBytes(Iterable<byte[]> lines) {
        for (byte[] l : lines) processLine(new String(l, StandardCharsets.ISO_8859_1));
        finish();
        return tokens();
    }

    /**
     * Consumes one chunk of source. The chunk need not end at a statement or line
     * boundary, and may contain several lines.
     *
     * @throws LexerException if text remains that matches no token
     */
    public void processLine(String text) {
        int pos = 0;
        while (pos < text.length()) {
            int n = switch (state) {
                case NONE -> matchToken(text, pos);
                case IN_STRING -> continueString(text, pos);
                case IN_MULTILINE_COMMENT, IN_MULTILINE_STRING -> continueLongBracket(text, pos);
            };
            if (n == 0) {
                throw new LexerException("Syntax error (remaining:" + quoted(text.substring(pos)) + ")", line, col);
            }
            track(text, pos, n);
            pos += n;
        }
    }

    /**
     * Ends the input.
     *
     * @throws LexerException if a string or multiline comment is still open; the error
     *                        points at its opening delimiter
     */
    public void finish() {
        switch (state) {
            case IN_STRING -> throw new LexerException("Unterminated string", openLine, openCol);
            case IN_MULTILINE_COMMENT -> throw new LexerException("Unterminated multiline comment", openLine, openCol);
            case IN_MULTILINE_STRING -> throw new LexerException("Unterminated multiline string", openLine, openCol);
            case NONE -> { }
        }
    }

    public List<Token> tokens() {
        return new ArrayList<>(tokens);
    }

    public Dialect dialect() {
        return dialect;
    }

    // ================= token patterns, in priority order =================

    private int matchToken(String s, int pos) {
        char c = s.charAt(pos);

        if (c == '"' || c == '\'') {
            beginQuoted(c);
            return 1;
        }

        if (s.startsWith("--", pos)) {
            int level = longBracketLevel(s, pos + 2);
            if (level >= 0) {
                beginLongBracket(State.IN_MULTILINE_COMMENT, "--", level);
                return 2 + level + 2;
            }
            return lineComment(s, pos);
        }
        if (dialect.slashComments() && s.startsWith("//", pos)) {
            return lineComment(s, pos);
        }

        if (c == ' ' || c == '\t') {
            int end = pos;
            while (end < s.length() && (s.charAt(end) == ' ' || s.charAt(end) == '\t')) end++;
            return add(TokenKind.SPACE, s.substring(pos, end));
        }

        if (s.startsWith("\r\n", pos)) return add(TokenKind.NEWLINE, "\r\n");
        if (c == '\n' || c == '\r') return add(TokenKind.NEWLINE, String.valueOf(c));

        if (isDigit(c) || (c == '.' && pos + 1 < s.length() && isDigit(s.charAt(pos + 1)))) {
            for (Pattern p : List.of(HEX_NUMBER, BIN_NUMBER, DEC_NUMBER)) {
                Matcher m = p.matcher(s).region(pos, s.length());
                if (m.lookingAt()) return add(TokenKind.NUMBER, m.group());
            }
        }

        if (s.startsWith("::", pos)) {
            Matcher m = LABEL.matcher(s).region(pos, s.length());
            if (m.lookingAt()) {
                tokens.add(new Token(TokenKind.LABEL, m.group(), m.group(1), line, col));
                return m.group().length();
            }
        }

        // Keywords and names share the word scan; a word is a keyword only as a whole,
        // so "android" is a name.
        if (isNameStart(c)) {
            int end = pos + 1;
            while (end < s.length() && isNameChar(s.charAt(end))) end++;
            String word = s.substring(pos, end);
            return add(Dialect.isKeyword(word) ? TokenKind.KEYWORD : TokenKind.NAME, word);
        }

        if (c == '[') {
            int level = longBracketLevel(s, pos);
            if (level >= 0) {
                beginLongBracket(State.IN_MULTILINE_STRING, "", level);
                return level + 2;
            }
        }

        for (String sym : symbols) {
            if (s.startsWith(sym, pos)) return add(TokenKind.SYMBOL, sym);
        }

        if (c == '?' && dialect.printShorthand()) {
            return add(TokenKind.NAME, "?");
        }

        return 0;
    }

    private int lineComment(String s, int pos) {
        int end = pos;
        while (end < s.length() && s.charAt(end) != '\n' && s.charAt(end) != '\r') end++;
        return add(TokenKind.COMMENT, s.substring(pos, end));
    }

    // ================= strings =================

    private void beginQuoted(char delim) {
        state = State.IN_STRING;
        stringDelim = delim;
        openLine = line;
        openCol = col;
        raw.setLength(0);
        value.setLength(0);
        raw.append(delim);
    }

    private int continueString(String s, int pos) {
        int i = pos;
        while (i < s.length()) {
            char c = s.charAt(i);

            if (c == stringDelim) {
                raw.append(c);
                tokens.add(new Token(TokenKind.STRING, raw.toString(), value.toString(), openLine, openCol));
                state = State.NONE;
                return i + 1 - pos;
            }

            if (c == '\\' && i + 1 < s.length()) {
                int digits = 0;
                while (digits < 3 && i + 1 + digits < s.length() && isDigit(s.charAt(i + 1 + digits))) {
                    digits++;
                }
                if (digits > 0) {
                    // one char per byte
                    value.append((char) (Integer.parseInt(s.substring(i + 1, i + 1 + digits)) & 0xff));
                    raw.append(s, i, i + 1 + digits);
                    i += 1 + digits;
                    continue;
                }
                Character escaped = STRING_ESCAPES.get(s.charAt(i + 1));
                if (escaped != null) {
                    value.append(escaped.charValue());
                    raw.append(s, i, i + 2);
                    i += 2;
                    continue;
                }
                // unknown escape: kept as written
            }

            value.append(c);
            raw.append(c);
            i++;
        }
        return i - pos;
    }

    // ================= multiline comments and strings =================

    /** The level of a long bracket {@code [==[} starting at {@code pos}, or -1. */
    private static int longBracketLevel(String s, int pos) {
        if (pos >= s.length() || s.charAt(pos) != '[') return -1;
        int level = 0;
        while (pos + 1 + level < s.length() && s.charAt(pos + 1 + level) == '=') level++;
        if (pos + 1 + level < s.length() && s.charAt(pos + 1 + level) == '[') return level;
        return -1;
    }

    private void beginLongBracket(State st, String prefix, int level) {
        state = st;
        bracketLevel = level;
        openLine = line;
        openCol = col;
        raw.setLength(0);
        raw.append(prefix).append('[').append("=".repeat(level)).append('[');
    }

    private int continueLongBracket(String s, int pos) {
        String close = "]" + "=".repeat(bracketLevel) + "]";
        int idx = s.indexOf(close, pos);
        if (idx < 0) {
            raw.append(s, pos, s.length());
            return s.length() - pos;
        }
        int end = idx + close.length();
        raw.append(s, pos, end);
        String text = raw.toString();
        if (state == State.IN_MULTILINE_COMMENT) {
            tokens.add(new Token(TokenKind.COMMENT, text, openLine, openCol));
        } else {
            String contents = text.substring(bracketLevel + 2, text.length() - close.length());
            // a newline right after the opening bracket is not part of the string
            if (contents.startsWith("\r\n")) contents = contents.substring(2);
            else if (contents.startsWith("\n")) contents = contents.substring(1);
            tokens.add(new Token(TokenKind.STRING, text, contents, openLine, openCol));
        }
        state = State.NONE;
        return end - pos;
    }

    // ================= helpers =================

    private int add(TokenKind kind, String text) {
        tokens.add(new Token(kind, text, line, col));
        return text.length();
    }

    /** Advances line/column over {@code n} consumed chars. */
    private void track(String s, int pos, int n) {
        for (int i = pos; i < pos + n; i++) {
            char c = s.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= s.length() || s.charAt(i + 1) != '\n'))) {
                line++;
                col = 1;
            } else if (c != '\r') {
                col++;
            }
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' ||
                (c >= 0x80 && c <= 0xff);
    }

    static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c);
    }

    private static String quoted(String text) {
        return "'" + text.replace("\n", "\\n").replace("\r", "\\r") + "'";
    }
}
