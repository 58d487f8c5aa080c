package p8lua.ast.expr;

public record CallExpr(Expr callee, Args args) implements Expr {}
