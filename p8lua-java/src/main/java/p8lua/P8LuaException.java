package p8lua;

/**
 * Base class for every error the source pipeline reports about its input.
 */
public class P8LuaException extends RuntimeException {

    public P8LuaException(String message) {
        super(message);
    }

    public P8LuaException(String message, Throwable cause) {
        super(message, cause);
    }
}
