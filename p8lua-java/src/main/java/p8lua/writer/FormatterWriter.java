package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.List;
import java.util.stream.Stream;

/**
 * Re-indents a program from its block structure.
 *
 * <p>Line breaks are taken from the source, with runs of blank lines reduced to one.
 * Each line is indented by its block and table nesting depth times the indent width.
 * Binary and assignment operators get a space on both sides and commas a space after.
 * Calls, indexing and field access are written without spaces. Elsewhere a space is
 * kept where the source had one. A comment that ended a line
 * stays there after a two-space gutter, and a comment on its own line is indented
 * like code.
 */
public final class FormatterWriter implements LuaWriter {

    private static final String COMMENT_GUTTER = "  ";

    private final int indentWidth;

    public FormatterWriter(int indentWidth) {
        if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
        this.indentWidth = indentWidth;
    }

    public int indentWidth() {
        return indentWidth;
    }

    @Override
    public Stream<String> render(List<Token> tokens, Chunk root) {
        return Stream.of(root).flatMap(r -> Lines.split(new Emitter(indentWidth).write(r)));
    }

    private static final class Emitter extends AstTokenWriter {
        private final int indentWidth;
        private int depth;
        private int pendingDedent;
        private boolean atLineStart = true;
        private boolean afterComment;
        private String previous = "";
        private Role previousRole;

        Emitter(int indentWidth) {
            this.indentWidth = indentWidth;
        }

        // ---------- structure ----------

        @Override
        protected void enterBlock(boolean oneLine) {
            if (!oneLine) depth++;
        }

        /** Takes effect at the next lexeme, after its leading comments. */
        @Override
        protected void exitBlock(boolean oneLine) {
            if (!oneLine) pendingDedent++;
        }

        @Override
        protected void enterTable() {
            depth++;
        }

        @Override
        protected void exitTable() {
            pendingDedent++;
        }

        // ---------- output ----------

        @Override
        protected void writeLexeme(Lexeme lexeme, Role role) {
            int newlines = trivia(lexeme.trivia());
            depth -= pendingDedent;
            pendingDedent = 0;
            breakLines(newlines);

            String text = lexeme.text();
            if (atLineStart) {
                indent();
            } else if (afterComment || wantsSpace(role, text, hasSpace(lexeme.trivia()))) {
                out.append(' ');
            }
            out.append(text);
            atLineStart = false;
            afterComment = false;
            previous = text;
            previousRole = role;
        }

        @Override
        protected void writeTrailing(List<Token> trivia) {
            int newlines = trivia(trivia);
            if (newlines > 0 && out.length() > 0) out.append('\n');
        }

        /**
         * Writes the comments in {@code trivia} and returns the number of line breaks
         * after the last of them.
         */
        private int trivia(List<Token> trivia) {
            int newlines = 0;
            for (Token t : trivia) {
                if (t.is(TokenKind.NEWLINE)) {
                    newlines++;
                } else if (t.is(TokenKind.COMMENT)) {
                    if (newlines == 0 && !atLineStart) {
                        out.append(COMMENT_GUTTER);
                    } else {
                        breakLines(newlines);
                        if (atLineStart) indent();
                    }
                    out.append(t.text());
                    atLineStart = false;
                    afterComment = true;
                    newlines = 0;
                }
            }
            return newlines;
        }

        /** At most one blank line; none at the start of the output. */
        private void breakLines(int newlines) {
            if (newlines == 0 || out.length() == 0) return;
            out.append(newlines > 1 ? "\n\n" : "\n");
            atLineStart = true;
            afterComment = false;
        }

        private void indent() {
            out.append(" ".repeat(Math.max(0, depth) * indentWidth));
        }

        private static boolean hasSpace(List<Token> trivia) {
            for (Token t : trivia) {
                if (t.is(TokenKind.SPACE)) return true;
            }
            return false;
        }

        // ---------- spacing ----------

        private boolean wantsSpace(Role role, String text, boolean sourceHadSpace) {
            if (TokenJoiner.needsSpace(previous, text)) return true;
            if (previousRole == Role.OPEN || previousRole == Role.DOT || previousRole == Role.COLON ||
                    previousRole == Role.UNARY_OP) {
                return false;
            }
            if (role == Role.CLOSE || role == Role.COMMA || role == Role.SEPARATOR ||
                    role == Role.DOT || role == Role.COLON) {
                return false;
            }
            // call arguments and indexing
            if (role == Role.OPEN && (previousRole == Role.NAME || previousRole == Role.CLOSE)) return false;
            if (role == Role.BINARY_OP || role == Role.ASSIGN_OP ||
                    previousRole == Role.BINARY_OP || previousRole == Role.ASSIGN_OP) {
                return true;
            }
            if (previousRole == Role.COMMA || previousRole == Role.SEPARATOR) return true;
            if (previousRole == Role.KEYWORD) {
                return !(previous.equals("function") && text.equals("("));
            }
            if (role == Role.KEYWORD) return true;
            return sourceHadSpace;
        }
    }
}
