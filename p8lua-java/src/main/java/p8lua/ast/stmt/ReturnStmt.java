package p8lua.ast.stmt;

import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;

/** @param values null for a bare {@code return} */
public record ReturnStmt(Lexeme returnKw, ExpList values) implements Stmt {}
