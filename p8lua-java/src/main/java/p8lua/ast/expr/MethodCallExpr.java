package p8lua.ast.expr;

import p8lua.ast.Lexeme;

/** {@code receiver:method(args)} */
public record MethodCallExpr(Expr receiver, Lexeme colon, Lexeme method, Args args) implements Expr {}
