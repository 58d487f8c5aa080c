package p8lua.ast.expr;

import p8lua.ast.Lexeme;

/** A parenthesized expression; kept as a node so the parentheses survive re-rendering. */
public record ParenExpr(Lexeme open, Expr inner, Lexeme close) implements Expr {}
