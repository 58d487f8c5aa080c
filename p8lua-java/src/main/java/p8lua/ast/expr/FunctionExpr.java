package p8lua.ast.expr;

import p8lua.ast.FunctionBody;
import p8lua.ast.Lexeme;

public record FunctionExpr(Lexeme functionKw, FunctionBody body) implements Expr {}
