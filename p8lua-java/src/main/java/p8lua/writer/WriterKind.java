package p8lua.writer;

import java.util.Locale;

/** The writers selectable from configuration. */
public enum WriterKind {
    ECHO("echo"),
    AST_ECHO("ast-echo"),
    MINIFY("minify"),
    FORMAT("format");

    private final String key;

    WriterKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public LuaWriter create(int indentWidth) {
        return switch (this) {
            case ECHO -> new EchoWriter();
            case AST_ECHO -> new AstEchoWriter();
            case MINIFY -> new MinifyWriter();
            case FORMAT -> new FormatterWriter(indentWidth);
        };
    }

    /** Looks a kind up by its configuration key, such as {@code ast-echo}. */
    public static WriterKind fromKey(String key) {
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (WriterKind kind : values()) {
            if (kind.key.equals(k)) return kind;
        }
        throw new IllegalArgumentException("Unknown writer: " + key);
    }
}
