package p8lua.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import p8lua.LuaSource;
import p8lua.config.PipelineConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ModuleResolverTest {

    @TempDir
    Path dir;

    private Path write(String name, String text) throws IOException {
        Path p = dir.resolve(name);
        Files.createDirectories(p.getParent());
        Files.writeString(p, text);
        return p;
    }

    private LuaSource build(Path main) throws IOException {
        return build(main, PipelineConfig.defaults());
    }

    private LuaSource build(Path main, PipelineConfig config) throws IOException {
        LuaSource source = LuaSource.fromString(Files.readString(main));
        return ModuleResolver.build(source, main, config);
    }

    private static String text(LuaSource source) {
        return source.toLines().reduce("", String::concat);
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void program_without_includes_is_unchanged() throws IOException {
        Path main = write("main.p8", "print(1)\n");
        LuaSource source = LuaSource.fromString("print(1)\n");
        assertSame(source, ModuleResolver.build(source, main, PipelineConfig.defaults()));
    }

    @Test
    void inlines_module_after_loader() throws IOException {
        write("lib.lua", "x = 1");
        Path main = write("main.p8", "require('lib')\nprint(x)\n");

        assertEquals("""
                package={loaded={},_c={}}
                function require(p)
                local l=package.loaded
                if (l[p]==nil) l[p]=package._c[p]()
                if (l[p]==nil) l[p]=true
                return l[p]
                end
                package._c["lib"]=function()
                x = 1
                end
                require('lib')
                print(x)
                """, text(build(main)));
    }

    @Test
    void each_literal_is_loaded_once() throws IOException {
        write("foo.lua", "foo = 1\n");
        Path main = write("main.p8", "require('foo')\nrequire('foo')\nrequire('foo.lua')\n");

        String out = text(build(main));
        assertEquals(2, count(out, "foo = 1"));
        assertEquals(1, count(out, "package._c[\"foo\"]"));
        assertEquals(1, count(out, "package._c[\"foo.lua\"]"));
    }

    @Test
    void nested_includes_resolve_relative_to_their_file() throws IOException {
        write("lib/a.lua", "require('b')\na = 1\n");
        write("lib/b.lua", "b = 2\n");
        Path main = write("main.p8", "require('lib/a')\n");

        String out = text(build(main));
        assertTrue(out.indexOf("package._c[\"lib/a\"]") < out.indexOf("package._c[\"b\"]"));
        assertTrue(out.contains("b = 2"));
    }

    @Test
    void include_cycles_terminate() throws IOException {
        write("a.lua", "require('b')\n");
        write("b.lua", "require('a')\n");
        Path main = write("main.p8", "require('a')\n");

        String out = text(build(main));
        assertEquals(1, count(out, "package._c[\"a\"]"));
        assertEquals(1, count(out, "package._c[\"b\"]"));
    }

    @Test
    void output_is_a_valid_program() throws IOException {
        write("m.lua", "local t = {}\nfunction t.go() return 1 end\nreturn t -- exported\n");
        Path main = write("main.p8", "local m = require('m')\n?m.go()\n");

        LuaSource out = build(main);
        assertEquals(LuaSource.fromString(text(out)).tokenCount(), out.tokenCount());
        assertTrue(out.tokenCount() > LuaSource.fromString("local m = require('m')\n?m.go()\n").tokenCount());
    }

    @Test
    void lifecycle_callbacks_are_stripped_from_modules() throws IOException {
        write("mod.lua", "function _init() end\nfunction helper() end\nfunction _update60() end\nfunction _draw() end\n");
        Path main = write("main.p8", "require('mod')\nfunction _init() end\n");

        String out = text(build(main));
        assertTrue(out.contains("function helper()"));
        assertFalse(out.contains("_update60"));
        assertFalse(out.contains("_draw"));
        // the program's own callback stays
        assertEquals(1, count(out, "function _init()"));
    }

    @Test
    void use_game_loop_keeps_callbacks() throws IOException {
        write("mod.lua", "function _draw() end\n");
        Path main = write("main.p8", "require('mod', {use_game_loop=true})\n");
        assertTrue(text(build(main)).contains("function _draw()"));
    }

    @Test
    void first_include_decides_game_loop() throws IOException {
        write("mod.lua", "function _draw() end\n");
        Path main = write("main.p8", "require('mod')\nrequire('mod', {use_game_loop=true})\n");
        assertFalse(text(build(main)).contains("_draw"));
    }

    @Test
    void config_can_keep_callbacks() throws IOException {
        write("mod.lua", "function _draw() end\n");
        Path main = write("main.p8", "require('mod')\n");
        PipelineConfig keep = PipelineConfig.defaults().with(props("p8lua.keep-lifecycle-callbacks", "true"));
        assertTrue(text(build(main, keep)).contains("function _draw()"));
    }

    @Test
    void strip_only_touches_top_level_declarations() {
        LuaSource module = LuaSource.fromString("do function _init() end end\nlocal function _draw() end\nt._update = 1\n");
        assertSame(module, ModuleResolver.stripLifecycleCallbacks(module));
    }

    @Test
    void missing_module_reports_path() throws IOException {
        Path main = write("main.p8", "x = 1\nrequire('nope')\n");
        var ex = assertThrows(ModuleBuildException.class, () -> build(main));
        assertEquals("require() file nope not found; used load path ?;?.lua at line 2 char 1", ex.getMessage());
    }

    @Test
    void traversal_is_rejected() throws IOException {
        write("x.lua", "x = 1\n");
        Path main = write("sub/main.p8", "require('../x')\n");
        var ex = assertThrows(ModuleBuildException.class, () -> build(main));
        assertEquals("require() filename cannot contain \"./\" or \"../\" or start with \"/\"", ex.msg());

        Path abs = write("abs.p8", "require('/etc/passwd')\n");
        assertThrows(ModuleBuildException.class, () -> build(abs));
    }

    @Test
    void custom_lua_path_and_loader() {
        Map<Path, String> files = new HashMap<>();
        files.put(Path.of("/carts/lib/util.lua"), "u = 1\n");
        SourceLoader memory = new SourceLoader() {
            @Override
            public boolean exists(Path path) {
                return files.containsKey(path);
            }

            @Override
            public String read(Path path) {
                return files.get(path);
            }
        };
        ResolutionContext context = new ResolutionContext(LuaPath.parse("lib/?.lua"), false, 8, memory);
        LuaSource out = new ModuleResolver(context)
                .resolve(LuaSource.fromString("require('util')\n"), Path.of("/carts/main.p8"));

        assertEquals(1, context.modules().size());
        assertTrue(context.isLoaded("util"));
        assertTrue(text(out).contains("u = 1"));
    }

    @Test
    void unreadable_module_is_wrapped() {
        SourceLoader failing = new SourceLoader() {
            @Override
            public boolean exists(Path path) {
                return true;
            }

            @Override
            public String read(Path path) throws IOException {
                throw new IOException("disk on fire");
            }
        };
        ResolutionContext context = new ResolutionContext(LuaPath.defaultPath(), false, 8, failing);
        var ex = assertThrows(ModuleBuildException.class, () -> new ModuleResolver(context)
                .resolve(LuaSource.fromString("require('x')"), Path.of("/carts/main.p8")));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    private static Properties props(String key, String value) {
        Properties p = new Properties();
        p.setProperty(key, value);
        return p;
    }
}
