package p8lua.ast.stmt;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.expr.Expr;

/** {@code for name = start, limit[, step] do body end}; {@code stepComma} and {@code step} may be null. */
public record ForNumStmt(
        Lexeme forKw,
        Lexeme name,
        Lexeme eq,
        Expr start,
        Lexeme limitComma,
        Expr limit,
        Lexeme stepComma,
        Expr step,
        Lexeme doKw,
        Chunk body,
        Lexeme endKw
) implements Stmt {}
