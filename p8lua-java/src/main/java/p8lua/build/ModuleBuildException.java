package p8lua.build;

import p8lua.lexer.Token;
import p8lua.parser.ParserException;

/** A {@code require()} that cannot be resolved, anchored at the call's {@code require} token. */
public class ModuleBuildException extends ParserException {

    public ModuleBuildException(String msg, Token token) {
        super(msg, token);
    }

    public ModuleBuildException(String msg, Token token, Throwable cause) {
        super(msg, token, cause);
    }
}
