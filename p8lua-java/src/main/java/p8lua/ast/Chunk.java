package p8lua.ast;

import p8lua.ast.stmt.Stmt;
import p8lua.lexer.Token;

import java.util.List;

/**
 * An ordered list of statements: the root of a program or the body of a block.
 * {@code trailingTrivia} holds what follows the last statement of a program; blocks
 * leave it empty, since that trivia belongs to their closing keyword.
 */
public record Chunk(List<Stmt> statements, List<Token> trailingTrivia) implements Node {

    public Chunk {
        statements = List.copyOf(statements);
        trailingTrivia = List.copyOf(trailingTrivia);
    }

    public static Chunk of(List<Stmt> statements) {
        return new Chunk(statements, List.of());
    }

    public Chunk withStatements(List<Stmt> newStatements) {
        return new Chunk(newStatements, trailingTrivia);
    }
}
