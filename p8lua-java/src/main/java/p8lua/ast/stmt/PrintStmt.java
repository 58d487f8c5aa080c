package p8lua.ast.stmt;

import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;

/** The {@code ?expr, ...} print shorthand, which runs to the end of its line. */
public record PrintStmt(Lexeme question, ExpList args) implements Stmt {}
