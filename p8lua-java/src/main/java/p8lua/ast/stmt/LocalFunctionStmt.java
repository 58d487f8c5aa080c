package p8lua.ast.stmt;

import p8lua.ast.FunctionBody;
import p8lua.ast.Lexeme;

public record LocalFunctionStmt(Lexeme localKw, Lexeme functionKw, Lexeme name, FunctionBody body) implements Stmt {}
