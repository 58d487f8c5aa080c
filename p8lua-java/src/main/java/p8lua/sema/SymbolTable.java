package p8lua.sema;

import java.util.ArrayDeque;
import java.util.Deque;

/** Stack of block scopes, innermost first. */
public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable() { push(); }

    public void push() { scopes.push(new Scope()); }
    public void pop() { scopes.pop(); }

    public void define(LocalSymbol sym) { scopes.peek().define(sym); }

    /** The innermost visible local called {@code name}, or null for a global. */
    public LocalSymbol lookup(String name) {
        for (Scope s : scopes) {
            LocalSymbol sym = s.getLocal(name);
            if (sym != null) return sym;
        }
        return null;
    }

    /** True if a local in any enclosing scope already goes by {@code newName}. */
    public boolean inUse(String newName) {
        for (Scope s : scopes) {
            if (s.reserves(newName)) return true;
        }
        return false;
    }
}
