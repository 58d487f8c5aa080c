package p8lua.writer;

import p8lua.lexer.Lexer;
import p8lua.lexer.LexerException;
import p8lua.lexer.Token;

import java.util.List;

/** Decides whether two adjacent tokens need a space between them to lex back the same. */
public final class TokenJoiner {
    private TokenJoiner() {}

    public static boolean needsSpace(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) return false;
        char l = left.charAt(left.length() - 1);
        char r = right.charAt(0);

        // names, keywords and numbers run together
        if (isWordChar(l) && isWordChar(r)) return true;

        // the console reads numerals greedily: "1..b" is a malformed number there
        if (r == '.' && isNumber(left)) return true;

        try {
            List<Token> tokens = Lexer.tokenize(left + right);
            return tokens.isEmpty() || !tokens.get(0).text().equals(left);
        } catch (LexerException e) {
            // e.g. "[" followed by "[" opens an unterminated long string
            return true;
        }
    }

    private static boolean isNumber(String text) {
        char c = text.charAt(0);
        return isDigit(c) || (c == '.' && text.length() > 1 && isDigit(text.charAt(1)));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                (c >= '0' && c <= '9') ||
                c == '_' ||
                (c >= 0x80 && c <= 0xff);
    }
}
