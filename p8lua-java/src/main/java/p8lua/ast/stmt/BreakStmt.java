package p8lua.ast.stmt;

import p8lua.ast.Lexeme;

public record BreakStmt(Lexeme breakKw) implements Stmt {}
