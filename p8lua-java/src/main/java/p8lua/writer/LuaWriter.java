package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.lexer.Token;

import java.util.List;
import java.util.stream.Stream;

/** Turns a token list and its tree back into source text. */
public interface LuaWriter {

    /**
     * Renders the program as lines, each ending with its line terminator except
     * possibly the last. Every call builds fresh state; nothing is computed until the
     * stream is consumed.
     */
    Stream<String> render(List<Token> tokens, Chunk root);

    /** The rendered program as one string. */
    default String renderToString(List<Token> tokens, Chunk root) {
        StringBuilder sb = new StringBuilder();
        render(tokens, root).forEach(sb::append);
        return sb.toString();
    }
}
