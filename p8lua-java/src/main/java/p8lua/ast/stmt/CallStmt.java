package p8lua.ast.stmt;

import p8lua.ast.expr.Expr;

/** A call used as a statement; {@code call} is a call or method call expression. */
public record CallStmt(Expr call) implements Stmt {}
