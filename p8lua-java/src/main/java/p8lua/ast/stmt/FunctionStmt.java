package p8lua.ast.stmt;

import p8lua.ast.FunctionBody;
import p8lua.ast.FunctionName;
import p8lua.ast.Lexeme;

public record FunctionStmt(Lexeme functionKw, FunctionName name, FunctionBody body) implements Stmt {}
