package p8lua.sema;

/**
 * A local variable, parameter or local function.
 *
 * @param newName the short name assigned to it, or null while only resolving scopes
 */
public record LocalSymbol(String name, String newName) {}
