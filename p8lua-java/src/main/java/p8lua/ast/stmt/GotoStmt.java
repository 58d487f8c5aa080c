package p8lua.ast.stmt;

import p8lua.ast.Lexeme;

public record GotoStmt(Lexeme gotoKw, Lexeme label) implements Stmt {}
