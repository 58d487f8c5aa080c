package p8lua.walker;

import p8lua.ast.Node;

import java.util.Objects;

/** What the walker does after a visitor has seen a node. */
public final class VisitAction {

    public enum Kind { PROCEED, SKIP_CHILDREN, REPLACE, REMOVE, STOP }

    private static final VisitAction PROCEED = new VisitAction(Kind.PROCEED, null);
    private static final VisitAction SKIP_CHILDREN = new VisitAction(Kind.SKIP_CHILDREN, null);
    private static final VisitAction REMOVE = new VisitAction(Kind.REMOVE, null);
    private static final VisitAction STOP = new VisitAction(Kind.STOP, null);

    private final Kind kind;
    private final Node replacement;

    private VisitAction(Kind kind, Node replacement) {
        this.kind = kind;
        this.replacement = replacement;
    }

    /** Continue into the node's children. */
    public static VisitAction proceed() {
        return PROCEED;
    }

    public static VisitAction skipChildren() {
        return SKIP_CHILDREN;
    }

    /**
     * Put {@code node} in place of the visited node and walk the replacement's children.
     * The replacement must fit the slot: a statement for a statement, and so on.
     */
    public static VisitAction replace(Node node) {
        return new VisitAction(Kind.REPLACE, Objects.requireNonNull(node, "node"));
    }

    /** Drop the visited statement from its block. Only valid at {@link VisitPoint#STATEMENT}. */
    public static VisitAction remove() {
        return REMOVE;
    }

    /** End the whole traversal; the tree keeps the changes made so far. */
    public static VisitAction stop() {
        return STOP;
    }

    public Kind kind() {
        return kind;
    }

    public Node replacement() {
        return replacement;
    }
}
