package p8lua.ast.stmt;

import p8lua.ast.Lexeme;

/** {@code ::name::}, held as a single label token. */
public record LabelStmt(Lexeme label) implements Stmt {}
