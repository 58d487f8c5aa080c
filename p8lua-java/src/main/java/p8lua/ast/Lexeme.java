package p8lua.ast;

import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.List;

/**
 * A significant token as it sits in the tree, together with the whitespace, newline
 * and comment tokens that preceded it in the source.
 */
public record Lexeme(Token token, List<Token> trivia) {

    public Lexeme {
        trivia = List.copyOf(trivia);
    }

    public static Lexeme of(Token token) {
        return new Lexeme(token, List.of());
    }

    /** A generated lexeme with no position and no trivia. */
    public static Lexeme synthetic(TokenKind kind, String text) {
        return of(Token.synthetic(kind, text));
    }

    public static Lexeme keyword(String word) {
        return of(Token.keyword(word));
    }

    public static Lexeme symbol(String sym) {
        return of(Token.symbol(sym));
    }

    public static Lexeme name(String name) {
        return of(Token.name(name));
    }

    public String text() {
        return token.text();
    }

    public boolean isSynthetic() {
        return token.isSynthetic();
    }
}
