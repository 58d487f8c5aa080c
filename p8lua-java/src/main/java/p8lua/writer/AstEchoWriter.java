package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.Nodes;
import p8lua.ast.stmt.Stmt;
import p8lua.lexer.Token;

import java.util.List;
import java.util.stream.Stream;

/**
 * Rebuilds the text from the tree: each lexeme is written after the trivia that
 * preceded it, so unchanged parts come out byte for byte. Generated lexemes carry no
 * trivia; they get a single space where they would otherwise run into a neighbour,
 * and a generated statement starts on a new line.
 */
public final class AstEchoWriter implements LuaWriter {

    @Override
    public Stream<String> render(List<Token> tokens, Chunk root) {
        return Stream.of(root).flatMap(r -> Lines.split(new Emitter().write(r)));
    }

    private static final class Emitter extends AstTokenWriter {
        private String previous = "";
        private boolean previousSynthetic;

        @Override
        protected void beforeStatement(Stmt s) {
            Lexeme first = Nodes.firstLexeme(s);
            if (first != null && first.isSynthetic() && out.length() > 0 && !endsWithNewline()) {
                out.append('\n');
                previous = "";
            }
        }

        @Override
        protected void writeLexeme(Lexeme lexeme, Role role) {
            for (Token t : lexeme.trivia()) out.append(t.text());
            boolean generatedJoin = lexeme.isSynthetic() || previousSynthetic;
            if (lexeme.trivia().isEmpty() && generatedJoin && TokenJoiner.needsSpace(previous, lexeme.text())) {
                out.append(' ');
            }
            out.append(lexeme.text());
            previous = lexeme.text();
            previousSynthetic = lexeme.isSynthetic();
        }

        @Override
        protected void writeTrailing(List<Token> trivia) {
            for (Token t : trivia) out.append(t.text());
        }

        private boolean endsWithNewline() {
            char c = out.charAt(out.length() - 1);
            return c == '\n' || c == '\r';
        }
    }
}
