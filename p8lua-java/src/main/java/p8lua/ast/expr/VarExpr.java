package p8lua.ast.expr;

import p8lua.ast.Lexeme;

public record VarExpr(Lexeme name) implements Expr {

    public String id() {
        return name.text();
    }
}
