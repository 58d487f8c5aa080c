package p8lua.ast;

/** Any element of the syntax tree. */
public interface Node {}
