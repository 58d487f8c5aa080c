package p8lua.lexer;

import p8lua.P8LuaException;

public class LexerException extends P8LuaException {
    private final String msg;
    private final int line;
    private final int column;

    public LexerException(String msg, int line, int column) {
        super(msg + " at line " + line + " char " + column);
        this.msg = msg;
        this.line = line;
        this.column = column;
    }

    /** The message without the position suffix. */
    public String msg() {
        return msg;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
