package p8lua.ast.stmt;

import p8lua.ast.Lexeme;

/** A lone {@code ;}. */
public record EmptyStmt(Lexeme semicolon) implements Stmt {}
