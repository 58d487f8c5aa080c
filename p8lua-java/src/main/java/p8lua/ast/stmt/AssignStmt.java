package p8lua.ast.stmt;

import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;
import p8lua.ast.VarList;

/** {@code targets op values}, where {@code op} is {@code =} or a compound form such as {@code +=}. */
public record AssignStmt(VarList targets, Lexeme op, ExpList values) implements Stmt {

    public boolean isCompound() {
        return !"=".equals(op.text());
    }
}
