package p8lua.ast.expr;

import p8lua.ast.Lexeme;

/** {@code prefix[index]} */
public record IndexExpr(Expr prefix, Lexeme open, Expr index, Lexeme close) implements Expr {}
