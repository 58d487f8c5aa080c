package p8lua.build;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The module search path: {@code ;}-separated patterns in which {@code ?} stands for
 * the literal passed to {@code require()}. Relative candidates are resolved against
 * the directory of the file doing the include.
 */
public final class LuaPath {

    public static final String DEFAULT = "?;?.lua";
    public static final String ENV_VAR = "PICO8_LUA_PATH";

    private final String spec;
    private final List<String> patterns;

    private LuaPath(String spec, List<String> patterns) {
        this.spec = spec;
        this.patterns = patterns;
    }

    public static LuaPath parse(String spec) {
        List<String> patterns = new ArrayList<>();
        for (String p : StringUtils.split(spec, ';')) {
            if (StringUtils.isNotBlank(p)) patterns.add(p.trim());
        }
        if (patterns.isEmpty()) throw new IllegalArgumentException("Empty lua path: '" + spec + "'");
        return new LuaPath(spec, List.copyOf(patterns));
    }

    public static LuaPath defaultPath() {
        return parse(DEFAULT);
    }

    public List<String> patterns() {
        return patterns;
    }

    /**
     * Every file the literal may refer to, in search order.
     *
     * @param includingFile the file containing the {@code require()}, or null for the
     *                      working directory
     */
    public List<Path> candidates(String literal, Path includingFile) {
        String baseDir = "";
        if (includingFile != null) {
            Path parent = includingFile.toAbsolutePath().getParent();
            if (parent != null) baseDir = parent.toString();
        }
        List<Path> out = new ArrayList<>();
        for (String pattern : patterns) {
            String candidate = pattern.replace("?", literal);
            String joined = FilenameUtils.getPrefixLength(candidate) > 0 || baseDir.isEmpty()
                    ? FilenameUtils.normalize(candidate)
                    : FilenameUtils.concat(baseDir, candidate);
            if (joined != null) out.add(Paths.get(joined));
        }
        return out;
    }

    /** The first candidate that {@code exists}. */
    public Optional<Path> locate(String literal, Path includingFile, Predicate<Path> exists) {
        for (Path candidate : candidates(literal, includingFile)) {
            if (exists.test(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return spec;
    }
}
