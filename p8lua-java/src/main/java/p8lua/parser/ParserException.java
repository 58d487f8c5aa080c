package p8lua.parser;

import p8lua.P8LuaException;
import p8lua.lexer.Token;

/**
 * No grammar production matches at the cursor. The anchoring token is null when the
 * parser ran out of input.
 */
public class ParserException extends P8LuaException {
    private final String msg;
    private final Token token;

    public ParserException(String msg, Token token) {
        super(describe(msg, token));
        this.msg = msg;
        this.token = token;
    }

    protected ParserException(String msg, Token token, Throwable cause) {
        super(describe(msg, token), cause);
        this.msg = msg;
        this.token = token;
    }

    private static String describe(String msg, Token token) {
        if (token == null) return msg + " at end of file";
        return msg + " at line " + token.line() + " char " + token.column();
    }

    public String msg() {
        return msg;
    }

    /** The offending token, or null at end of input. */
    public Token token() {
        return token;
    }
}
