package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.Nodes;
import p8lua.ast.stmt.IfStmt;
import p8lua.ast.stmt.PrintStmt;
import p8lua.ast.stmt.Stmt;
import p8lua.ast.stmt.WhileStmt;
import p8lua.lexer.Token;
import p8lua.sema.LocalRenamer;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Drops all comments and whitespace that are not needed to keep tokens apart, and
 * renames locals to short names (see {@link LocalRenamer}).
 *
 * <p>Statements follow each other directly, with a space only where two words would
 * merge. A statement starting with {@code (} is preceded by {@code ;} so it cannot be
 * read as a call on the previous line. The one-line {@code if}, {@code while} and
 * {@code ?} forms end at a line break, so one is written after them.
 */
public final class MinifyWriter implements LuaWriter {

    @Override
    public Stream<String> render(List<Token> tokens, Chunk root) {
        return Stream.of(root).flatMap(r -> Lines.split(new Emitter(LocalRenamer.rename(r)).write(r)));
    }

    private static final class Emitter extends AstTokenWriter {
        private final Map<Lexeme, String> renames;
        private String previous = "";
        private boolean newlinePending;
        private int oneLineDepth;

        Emitter(Map<Lexeme, String> renames) {
            this.renames = renames;
        }

        @Override
        protected void beforeStatement(Stmt s) {
            Lexeme first = Nodes.firstLexeme(s);
            if (first != null && "(".equals(first.text()) && !previous.isEmpty()) {
                emit(";");
            }
        }

        @Override
        protected void afterStatement(Stmt s) {
            if (oneLineDepth == 0 && isLineTerminated(s)) newlinePending = true;
        }

        private static boolean isLineTerminated(Stmt s) {
            return s instanceof PrintStmt ||
                    (s instanceof IfStmt i && i.isShort()) ||
                    (s instanceof WhileStmt w && w.isShort());
        }

        @Override
        protected void enterBlock(boolean oneLine) {
            if (oneLine) oneLineDepth++;
        }

        @Override
        protected void exitBlock(boolean oneLine) {
            if (oneLine) oneLineDepth--;
        }

        @Override
        protected void writeLexeme(Lexeme lexeme, Role role) {
            emit(renames.getOrDefault(lexeme, lexeme.text()));
        }

        private void emit(String text) {
            if (newlinePending) {
                out.append('\n');
                previous = "";
                newlinePending = false;
            }
            if (TokenJoiner.needsSpace(previous, text)) out.append(' ');
            out.append(text);
            previous = text;
        }

        @Override
        protected void writeTrailing(List<Token> trivia) {
            // comments and whitespace are dropped
        }
    }
}
