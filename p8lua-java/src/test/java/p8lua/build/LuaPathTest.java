package p8lua.build;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LuaPathTest {

    @Test
    void default_path_tries_bare_then_lua_suffix() {
        assertEquals(List.of("?", "?.lua"), LuaPath.defaultPath().patterns());
        assertEquals(LuaPath.DEFAULT, LuaPath.defaultPath().toString());
    }

    @Test
    void empty_patterns_are_skipped() {
        assertEquals(List.of("lib/?.lua", "?.p8"), LuaPath.parse("lib/?.lua;; ?.p8 ").patterns());
    }

    @Test
    void blank_path_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> LuaPath.parse(" ; "));
    }

    @Test
    void candidates_resolve_against_including_file() {
        LuaPath path = LuaPath.parse("?.lua;lib/?.lua;/usr/share/p8/?.lua");
        List<Path> c = path.candidates("util", Paths.get("/carts/game/main.p8"));
        assertEquals(List.of(
                Paths.get("/carts/game/util.lua"),
                Paths.get("/carts/game/lib/util.lua"),
                Paths.get("/usr/share/p8/util.lua")
        ), c);
    }

    @Test
    void candidates_without_including_file_stay_relative() {
        assertEquals(List.of(Paths.get("util"), Paths.get("util.lua")),
                LuaPath.defaultPath().candidates("util", null));
    }

    @Test
    void locate_returns_first_existing_candidate() {
        LuaPath path = LuaPath.defaultPath();
        Path main = Paths.get("/carts/main.p8");
        Set<Path> existing = Set.of(Paths.get("/carts/util.lua"));

        assertEquals(Optional.of(Paths.get("/carts/util.lua")), path.locate("util", main, existing::contains));
        assertEquals(Optional.empty(), path.locate("missing", main, existing::contains));
    }
}
