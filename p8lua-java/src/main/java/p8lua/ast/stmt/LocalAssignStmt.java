package p8lua.ast.stmt;

import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;
import p8lua.ast.NameList;

/** {@code local names [= values]}; {@code eq} and {@code values} are both null without an initializer. */
public record LocalAssignStmt(Lexeme localKw, NameList names, Lexeme eq, ExpList values) implements Stmt {}
