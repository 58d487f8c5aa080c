package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.Node;
import p8lua.ast.expr.Expr;

import java.util.List;

/**
 * An {@code if} with its {@code elseif} and {@code else} branches. The one-line
 * {@code if (cond) body [else body]} form has no {@code then} and a null {@code endKw}.
 */
public record IfStmt(
        List<Branch> branches,
        Lexeme endKw
) implements Stmt {

    public IfStmt {
        branches = List.copyOf(branches);
    }

    public boolean isShort() {
        return endKw == null;
    }

    /**
     * @param keyword   {@code if}, {@code elseif} or {@code else}
     * @param condition null for {@code else}
     * @param thenKw    null for {@code else} and for the one-line form
     */
    public record Branch(Lexeme keyword, Expr condition, Lexeme thenKw, Chunk body) implements Node {

        public boolean isElse() {
            return condition == null;
        }

        public Branch withBody(Chunk newBody) {
            return new Branch(keyword, condition, thenKw, newBody);
        }
    }
}
