package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.expr.Expr;

public record RepeatStmt(Lexeme repeatKw, Chunk body, Lexeme untilKw, Expr condition) implements Stmt {}
