package p8lua.ast.expr;

import p8lua.ast.Lexeme;

public record VarargExpr(Lexeme dots) implements Expr {}
