package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;
import p8lua.ast.NameList;

public record ForInStmt(
        Lexeme forKw,
        NameList names,
        Lexeme inKw,
        ExpList exps,
        Lexeme doKw,
        Chunk body,
        Lexeme endKw
) implements Stmt {}
