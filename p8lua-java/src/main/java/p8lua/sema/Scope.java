package p8lua.sema;

import java.util.HashMap;
import java.util.Map;

/** Locals declared in one block. A later declaration of the same name shadows the earlier one. */
public final class Scope {
    private final Map<String, LocalSymbol> symbols = new HashMap<>();

    public void define(LocalSymbol sym) {
        symbols.put(sym.name(), sym);
    }

    public LocalSymbol getLocal(String name) {
        return symbols.get(name);
    }

    boolean reserves(String newName) {
        for (LocalSymbol s : symbols.values()) {
            if (newName.equals(s.newName())) return true;
        }
        return false;
    }
}
