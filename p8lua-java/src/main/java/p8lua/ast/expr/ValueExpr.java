package p8lua.ast.expr;

import p8lua.ast.Lexeme;
import p8lua.lexer.TokenKind;

/** {@code nil}, {@code true}, {@code false}, a number or a string, kept as spelled. */
public record ValueExpr(Lexeme value) implements Expr {

    public boolean isString() {
        return value.token().is(TokenKind.STRING);
    }

    public boolean isNumber() {
        return value.token().is(TokenKind.NUMBER);
    }

    /** Decoded string contents; only meaningful when {@link #isString()}. */
    public String stringValue() {
        return value.token().value();
    }
}
