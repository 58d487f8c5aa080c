package p8lua.ast;

/**
 * Parameters and body shared by function statements and function expressions.
 *
 * @param params       named parameters, null when there are none
 * @param varargComma  the comma between the named parameters and {@code ...}, or null
 * @param varargs      the {@code ...} parameter, or null
 */
public record FunctionBody(
        Lexeme open,
        NameList params,
        Lexeme varargComma,
        Lexeme varargs,
        Lexeme close,
        Chunk body,
        Lexeme endKw
) implements Node {

    public boolean isVararg() {
        return varargs != null;
    }

    public FunctionBody withBody(Chunk newBody) {
        return new FunctionBody(open, params, varargComma, varargs, close, newBody, endKw);
    }
}
