package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;

public record DoStmt(Lexeme doKw, Chunk body, Lexeme endKw) implements Stmt {}
