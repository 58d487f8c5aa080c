package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Replays the token list exactly as lexed; the tree is not consulted. Lines are split
 * at newline tokens only, so a multiline string or comment stays within one line.
 */
public final class EchoWriter implements LuaWriter {

    @Override
    public Stream<String> render(List<Token> tokens, Chunk root) {
        return Stream.of(tokens).flatMap(EchoWriter::lines);
    }

    private static Stream<String> lines(List<Token> tokens) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (Token t : tokens) {
            line.append(t.text());
            if (t.is(TokenKind.NEWLINE)) {
                lines.add(line.toString());
                line.setLength(0);
            }
        }
        if (line.length() > 0) lines.add(line.toString());
        return lines.stream();
    }
}
