package p8lua.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import p8lua.LuaSource;
import p8lua.ast.stmt.FunctionStmt;
import p8lua.ast.stmt.Stmt;
import p8lua.config.PipelineConfig;
import p8lua.walker.AstWalker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inlines the modules a program includes with {@code require()}.
 *
 * <p>Each distinct include literal is loaded once, in the order first met, and its own
 * includes are resolved in turn. The result is the program prefixed by a small module
 * loader and one closure per module:
 *
 * <pre>
 * package={loaded={},_c={}}
 * function require(p) ... end
 * package._c["lib"]=function()
 *   -- module text
 * end
 * -- original program
 * </pre>
 *
 * <p>Included modules lose their top-level {@code _init}, {@code _update},
 * {@code _update60} and {@code _draw} functions unless the build keeps them or the
 * first include of that literal passes {@code {use_game_loop=true}}.
 */
public final class ModuleResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ModuleResolver.class);

    public static final Set<String> LIFECYCLE_CALLBACKS = Set.of("_init", "_update", "_update60", "_draw");

    static final List<String> PACKAGE_PREAMBLE = List.of(
            "package={loaded={},_c={}}\n");

    static final List<String> REQUIRE_PREAMBLE = List.of(
            "function require(p)\n",
            "local l=package.loaded\n",
            "if (l[p]==nil) l[p]=package._c[p]()\n",
            "if (l[p]==nil) l[p]=true\n",
            "return l[p]\n",
            "end\n");

    private final ResolutionContext context;

    public ModuleResolver(ResolutionContext context) {
        this.context = context;
    }

    /** Resolves {@code main}, read from {@code mainFile}, with a fresh context. */
    public static LuaSource build(LuaSource main, Path mainFile, PipelineConfig config) {
        return new ModuleResolver(ResolutionContext.of(config)).resolve(main, mainFile);
    }

    /**
     * @param mainFile the program's file, used to resolve relative includes; may be null
     * @return the program with its modules inlined, or {@code main} itself when it
     *         includes nothing
     * @throws ModuleBuildException for a malformed, disallowed or unresolvable include
     */
    public LuaSource resolve(LuaSource main, Path mainFile) {
        loadIncludes(main, mainFile);
        Map<String, LuaSource> modules = context.modules();
        if (modules.isEmpty()) return main;

        List<String> lines = new ArrayList<>(PACKAGE_PREAMBLE);
        lines.addAll(REQUIRE_PREAMBLE);
        modules.forEach((literal, module) -> {
            lines.add("package._c[\"" + literal.replace("\"", "\\\"") + "\"]=function()\n");
            lines.addAll(terminated(module.toLines().toList()));
            lines.add("end\n");
        });
        lines.addAll(main.toLines().toList());

        LOG.info("Inlined {} module(s) into {}", modules.size(), mainFile == null ? "<source>" : mainFile);
        return LuaSource.fromLines(lines, main.version());
    }

    private void loadIncludes(LuaSource source, Path file) {
        for (RequireCall call : AstWalker.collect(source.root(), new RequireWalker())) {
            String literal = call.path();
            if (literal.contains("./") || literal.startsWith("/")) {
                throw new ModuleBuildException(
                        "require() filename cannot contain \"./\" or \"../\" or start with \"/\"", call.token());
            }
            if (context.isLoaded(literal)) {
                // first include wins, use_game_loop included
                LOG.debug("require(\"{}\") already loaded", literal);
                continue;
            }

            Path found = context.luaPath().locate(literal, file, context.loader()::exists)
                    .orElseThrow(() -> new ModuleBuildException(
                            "require() file " + literal + " not found; used load path " + context.luaPath(),
                            call.token()));
            LuaSource module = load(found, call);
            if (!context.keepLifecycleCallbacks() && !call.useGameLoop()) {
                module = stripLifecycleCallbacks(module);
            }
            LOG.debug("require(\"{}\") resolved to {}", literal, found);

            // registered before recursing so include cycles terminate
            context.register(literal, module);
            loadIncludes(module, found);
        }
    }

    private LuaSource load(Path path, RequireCall call) {
        String text;
        try {
            text = context.loader().read(path);
        } catch (IOException e) {
            throw new ModuleBuildException("require() file " + path + " could not be read", call.token(), e);
        }
        return LuaSource.fromString(text, context.version());
    }

    /** Drops top-level lifecycle function declarations, re-rendering and reparsing if any were found. */
    static LuaSource stripLifecycleCallbacks(LuaSource module) {
        List<Stmt> kept = new ArrayList<>();
        for (Stmt s : module.root().statements()) {
            if (!isLifecycleCallback(s)) kept.add(s);
        }
        if (kept.size() == module.root().statements().size()) return module;
        return module.withRoot(module.root().withStatements(kept));
    }

    private static boolean isLifecycleCallback(Stmt s) {
        return s instanceof FunctionStmt f &&
                f.name().isSimple() &&
                LIFECYCLE_CALLBACKS.contains(f.name().path().get(0).text());
    }

    /** Makes sure the last line ends with a newline, so {@code end} starts its own line. */
    private static List<String> terminated(List<String> lines) {
        List<String> out = new ArrayList<>(lines);
        if (!out.isEmpty()) {
            String last = out.get(out.size() - 1);
            if (!last.endsWith("\n") && !last.endsWith("\r")) out.set(out.size() - 1, last + "\n");
        }
        return out;
    }
}
