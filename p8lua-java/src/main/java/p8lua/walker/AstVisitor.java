package p8lua.walker;

import p8lua.ast.Node;

import java.util.function.Consumer;

/**
 * Callbacks for {@link AstWalker}. Results are handed to {@code out}; the returned
 * action tells the walker how to continue.
 *
 * @param <R> type of the results a collecting visitor produces
 */
public interface AstVisitor<R> {

    default VisitAction visit(VisitPoint point, Node node, Consumer<R> out) {
        return VisitAction.proceed();
    }

    /**
     * Called for every call and method call expression, after {@link #visit} has seen
     * it at {@link VisitPoint#EXPRESSION} and before its children.
     */
    default VisitAction visitCall(CallSite call, Consumer<R> out) {
        return VisitAction.proceed();
    }
}
