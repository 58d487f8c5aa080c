package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.expr.Expr;

/**
 * {@code while cond do body end}, or the one-line {@code while (cond) body} form, in
 * which {@code doKw} and {@code endKw} are null.
 */
public record WhileStmt(
        Lexeme whileKw,
        Expr condition,
        Lexeme doKw,
        Chunk body,
        Lexeme endKw
) implements Stmt {

    public boolean isShort() {
        return doKw == null;
    }
}
