package p8lua.ast;

import java.util.List;

/**
 * The name of a {@code function} statement: {@code a.b.c} with an optional
 * {@code :method} suffix. {@code colon} and {@code method} are both null or both set.
 */
public record FunctionName(List<Lexeme> path, List<Lexeme> dots, Lexeme colon, Lexeme method) implements Node {

    public FunctionName {
        path = List.copyOf(path);
        dots = List.copyOf(dots);
    }

    /** True for a plain global name such as {@code _init}. */
    public boolean isSimple() {
        return path.size() == 1 && method == null;
    }

    public String dotted() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(path.get(i).text());
        }
        if (method != null) sb.append(':').append(method.text());
        return sb.toString();
    }
}
