package p8lua.config;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import p8lua.build.LuaPath;
import p8lua.lexer.Dialect;
import p8lua.writer.LuaWriter;
import p8lua.writer.WriterKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of a pipeline run.
 *
 * <p>Values are layered, later sources winning: built-in defaults, the classpath
 * resource {@value #RESOURCE}, explicit properties, and finally the
 * {@code PICO8_LUA_PATH} environment variable for the search path.
 *
 * @param indentWidth            spaces per nesting level for the formatter
 * @param luaPath                module search path, see {@link LuaPath}
 * @param keepLifecycleCallbacks keep {@code _init}/{@code _update}/{@code _draw} in included modules
 * @param writer                 the writer used for output
 * @param version                cartridge version tag selecting the dialect
 */
public record PipelineConfig(
        int indentWidth,
        String luaPath,
        boolean keepLifecycleCallbacks,
        WriterKind writer,
        int version
) {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "p8lua.properties";

    public static final String INDENT_WIDTH = "p8lua.indent-width";
    public static final String LUA_PATH = "p8lua.lua-path";
    public static final String KEEP_LIFECYCLE_CALLBACKS = "p8lua.keep-lifecycle-callbacks";
    public static final String WRITER = "p8lua.writer";
    public static final String VERSION = "p8lua.version";

    public PipelineConfig {
        if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
        if (StringUtils.isBlank(luaPath)) throw new IllegalArgumentException("luaPath must not be blank");
        if (writer == null) throw new IllegalArgumentException("writer must not be null");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(2, LuaPath.DEFAULT, false, WriterKind.ECHO, Dialect.DEFAULT_VERSION);
    }

    public static PipelineConfig load() {
        return load(new Properties());
    }

    public static PipelineConfig load(Properties overrides) {
        return load(RESOURCE, overrides, System.getenv());
    }

    static PipelineConfig load(String resource, Properties overrides, Map<String, String> env) {
        PipelineConfig config = defaults();

        Properties bundled = readResource(resource);
        if (!bundled.isEmpty()) {
            LOG.debug("Applying configuration from classpath:{}", resource);
            config = config.with(bundled);
        }
        if (!overrides.isEmpty()) {
            LOG.debug("Applying {} explicit configuration properties", overrides.size());
            config = config.with(overrides);
        }
        String envPath = env.get(LuaPath.ENV_VAR);
        if (StringUtils.isNotBlank(envPath)) {
            LOG.debug("Lua path taken from {}", LuaPath.ENV_VAR);
            config = config.withLuaPath(envPath);
        }
        return config;
    }

    private static Properties readResource(String resource) {
        Properties props = new Properties();
        ClassLoader cl = PipelineConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
        return props;
    }

    /**
     * This configuration with the {@code p8lua.*} keys present in {@code props} applied.
     *
     * @throws IllegalArgumentException if a value does not parse
     */
    public PipelineConfig with(Properties props) {
        int indent = indentWidth;
        String path = luaPath;
        boolean keep = keepLifecycleCallbacks;
        WriterKind kind = writer;
        int ver = version;

        for (String key : props.stringPropertyNames()) {
            String value = StringUtils.trimToEmpty(props.getProperty(key));
            switch (key) {
                case INDENT_WIDTH -> indent = parseCount(key, value);
                case LUA_PATH -> path = value;
                case KEEP_LIFECYCLE_CALLBACKS -> keep = parseFlag(key, value);
                case WRITER -> kind = parseWriter(key, value);
                case VERSION -> ver = parseCount(key, value);
                default -> {
                    if (key.startsWith("p8lua.")) LOG.warn("Ignoring unknown configuration key {}", key);
                }
            }
        }
        return new PipelineConfig(indent, path, keep, kind, ver);
    }

    public PipelineConfig withLuaPath(String path) {
        return new PipelineConfig(indentWidth, path, keepLifecycleCallbacks, writer, version);
    }

    public PipelineConfig withWriter(WriterKind kind) {
        return new PipelineConfig(indentWidth, luaPath, keepLifecycleCallbacks, kind, version);
    }

    /** A new instance of the configured writer. */
    public LuaWriter newWriter() {
        return writer.create(indentWidth);
    }

    // ---------- value parsing ----------

    private static int parseCount(String key, String value) {
        if (!NumberUtils.isDigits(value)) {
            throw new IllegalArgumentException(key + " must be a non-negative integer, got '" + value + "'");
        }
        return NumberUtils.toInt(value);
    }

    private static boolean parseFlag(String key, String value) {
        Boolean b = BooleanUtils.toBooleanObject(value);
        if (b == null) throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
        return b;
    }

    private static WriterKind parseWriter(String key, String value) {
        try {
            return WriterKind.fromKey(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " must be one of echo, ast-echo, minify, format, got '"
                    + value + "'", e);
        }
    }
}
