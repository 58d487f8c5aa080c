package p8lua;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import p8lua.ast.Chunk;
import p8lua.lexer.Dialect;
import p8lua.lexer.Lexer;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;
import p8lua.parser.Parser;
import p8lua.writer.AstEchoWriter;
import p8lua.writer.EchoWriter;
import p8lua.writer.LuaWriter;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A lexed and parsed program: its token list, its syntax tree and the version tag
 * that selected the dialect. Instances are immutable; rendering never changes them.
 */
public final class LuaSource {
    private static final Logger LOG = LoggerFactory.getLogger(LuaSource.class);

    private static final Set<String> FREE_SYMBOLS = Set.of(",", ".", ":", ";", ")", "]", "}");
    private static final Set<String> FREE_KEYWORDS = Set.of("end", "local");
    private static final Set<String> VALUE_CLOSERS = Set.of(")", "]", "}", "...");
    private static final Set<String> VALUE_KEYWORDS = Set.of("nil", "true", "false", "end");

    private final List<Token> tokens;
    private final Chunk root;
    private final int version;

    private LuaSource(List<Token> tokens, Chunk root, int version) {
        this.tokens = List.copyOf(tokens);
        this.root = root;
        this.version = version;
    }

    // ---------- construction ----------

    /**
     * Lexes and parses {@code lines}, which may split the text anywhere.
     *
     * @throws p8lua.lexer.LexerException   on text that is not a token
     * @throws p8lua.parser.ParserException on tokens that are not a program
     */
    public static LuaSource fromLines(Iterable<String> lines, int version) {
        return parsed(new Lexer(version).process(lines), version);
    }

    public static LuaSource fromLines(Iterable<String> lines) {
        return fromLines(lines, Dialect.DEFAULT_VERSION);
    }

    public static LuaSource fromString(String text, int version) {
        return fromLines(List.of(text), version);
    }

    public static LuaSource fromString(String text) {
        return fromString(text, Dialect.DEFAULT_VERSION);
    }

    /** Each byte is one character, as on the console. */
    public static LuaSource fromBytes(Iterable<byte[]> lines, int version) {
        return parsed(new Lexer(version).processBytes(lines), version);
    }

    private static LuaSource parsed(List<Token> tokens, int version) {
        Chunk root = Parser.parse(tokens);
        LOG.debug("Parsed {} tokens into {} top-level statements (version {})",
                tokens.size(), root.statements().size(), version);
        return new LuaSource(tokens, root, version);
    }

    // ---------- accessors ----------

    public List<Token> tokens() {
        return tokens;
    }

    public Chunk root() {
        return root;
    }

    public int version() {
        return version;
    }

    // ---------- counts ----------

    /** Characters of the raw source. */
    public int charCount() {
        int n = 0;
        for (Token t : tokens) n += t.length();
        return n;
    }

    /** Tokens other than whitespace, newlines and comments. */
    public int tokenCount() {
        int n = 0;
        for (Token t : tokens) {
            if (!t.isTrivia()) n++;
        }
        return n;
    }

    public int lineCount() {
        int n = 0;
        for (Token t : tokens) {
            if (t.is(TokenKind.NEWLINE)) n++;
        }
        return n;
    }

    /**
     * The token count the console charges against its limit. Closing brackets,
     * {@code , . : ;}, {@code end} and {@code local} are free, as is a minus sign
     * negating a number literal. A decimal literal with an exponent costs two.
     */
    public int platformTokenCount() {
        int n = 0;
        Token previous = null;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isTrivia()) continue;
            n += cost(t, previous, nextSignificant(i));
            previous = t;
        }
        return n;
    }

    private Token nextSignificant(int i) {
        for (int j = i + 1; j < tokens.size(); j++) {
            if (!tokens.get(j).isTrivia()) return tokens.get(j);
        }
        return null;
    }

    private static int cost(Token t, Token previous, Token next) {
        switch (t.kind()) {
            case SYMBOL:
                if (FREE_SYMBOLS.contains(t.text())) return 0;
                if (t.text().equals("-") && next != null && next.is(TokenKind.NUMBER) && isUnaryPosition(previous)) {
                    return 0;
                }
                return 1;
            case KEYWORD:
                return FREE_KEYWORDS.contains(t.text().toLowerCase(Locale.ROOT)) ? 0 : 1;
            case NUMBER:
                return hasExponent(t.text()) ? 2 : 1;
            default:
                return 1;
        }
    }

    /** True when a minus after {@code previous} cannot be a subtraction. */
    private static boolean isUnaryPosition(Token previous) {
        if (previous == null) return true;
        switch (previous.kind()) {
            case NAME:
            case NUMBER:
            case STRING:
                return false;
            case SYMBOL:
                return !VALUE_CLOSERS.contains(previous.text());
            case KEYWORD:
                return !VALUE_KEYWORDS.contains(previous.text().toLowerCase(Locale.ROOT));
            default:
                return true;
        }
    }

    private static boolean hasExponent(String number) {
        String lower = number.toLowerCase(Locale.ROOT);
        return !lower.startsWith("0x") && lower.indexOf('e') >= 0;
    }

    // ---------- metadata ----------

    /** The text of a comment in the first token, conventionally the cart's title. */
    public String title() {
        return commentAt(0);
    }

    /** The text of a comment in the third token, conventionally the author line. */
    public String byline() {
        return commentAt(2);
    }

    private String commentAt(int index) {
        if (tokens.size() <= index) return null;
        Token t = tokens.get(index);
        if (!t.is(TokenKind.COMMENT)) return null;
        return StringUtils.trim(StringUtils.removeStart(t.text(), "--"));
    }

    // ---------- rendering ----------

    public Stream<String> toLines(LuaWriter writer) {
        return writer.render(tokens, root);
    }

    /** The source exactly as read. */
    public Stream<String> toLines() {
        return toLines(new EchoWriter());
    }

    /** Renders with {@code writer} and parses the result. */
    public LuaSource reparse(LuaWriter writer) {
        return fromLines(toLines(writer).toList(), version);
    }

    /**
     * A program for a changed tree. The tree is rendered and parsed again so that
     * the token list and the positions in the new tree agree.
     */
    public LuaSource withRoot(Chunk newRoot) {
        return fromLines(new AstEchoWriter().render(tokens, newRoot).toList(), version);
    }

    @Override
    public String toString() {
        return "LuaSource[version=" + version + ", tokens=" + tokens.size() +
                ", statements=" + root.statements().size() + "]";
    }
}
