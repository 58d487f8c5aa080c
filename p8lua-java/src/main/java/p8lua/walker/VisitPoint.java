package p8lua.walker;

/** Where in the tree a visitor is being called. */
public enum VisitPoint {
    /** A chunk: the program root or a block body. */
    BLOCK,
    STATEMENT,
    EXPRESSION,
    /** A table constructor field. */
    FIELD,
    /** The parameters and body of a function statement or expression. */
    FUNCTION
}
