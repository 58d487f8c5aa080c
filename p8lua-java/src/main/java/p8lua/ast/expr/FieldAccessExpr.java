package p8lua.ast.expr;

import p8lua.ast.Lexeme;

/** {@code prefix.name} */
public record FieldAccessExpr(Expr prefix, Lexeme dot, Lexeme name) implements Expr {}
