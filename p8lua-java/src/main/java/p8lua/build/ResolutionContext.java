package p8lua.build;

import p8lua.LuaSource;
import p8lua.config.PipelineConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one build: the modules loaded so far, keyed by the literal they were
 * included with and kept in resolution order, plus the settings every nested include
 * shares. Create one per top-level build.
 */
public final class ResolutionContext {
    private final LuaPath luaPath;
    private final boolean keepLifecycleCallbacks;
    private final int version;
    private final SourceLoader loader;
    private final Map<String, LuaSource> modules = new LinkedHashMap<>();

    public ResolutionContext(LuaPath luaPath, boolean keepLifecycleCallbacks, int version, SourceLoader loader) {
        this.luaPath = luaPath;
        this.keepLifecycleCallbacks = keepLifecycleCallbacks;
        this.version = version;
        this.loader = loader;
    }

    public static ResolutionContext of(PipelineConfig config) {
        return new ResolutionContext(LuaPath.parse(config.luaPath()), config.keepLifecycleCallbacks(),
                config.version(), SourceLoader.files());
    }

    public LuaPath luaPath() {
        return luaPath;
    }

    public boolean keepLifecycleCallbacks() {
        return keepLifecycleCallbacks;
    }

    public int version() {
        return version;
    }

    public SourceLoader loader() {
        return loader;
    }

    public boolean isLoaded(String literal) {
        return modules.containsKey(literal);
    }

    void register(String literal, LuaSource module) {
        modules.put(literal, module);
    }

    /** Loaded modules in resolution order. */
    public Map<String, LuaSource> modules() {
        return Collections.unmodifiableMap(modules);
    }
}
