package p8lua.ast.expr;

import p8lua.ast.Node;

public sealed interface Expr extends Node
        permits ValueExpr, VarargExpr, BinaryExpr, UnaryExpr, ParenExpr,
        VarExpr, IndexExpr, FieldAccessExpr, CallExpr, MethodCallExpr,
        FunctionExpr, TableExpr {

    /** True for expressions that may appear on the left of an assignment. */
    default boolean isAssignable() {
        return this instanceof VarExpr || this instanceof IndexExpr || this instanceof FieldAccessExpr;
    }

    default boolean isCall() {
        return this instanceof CallExpr || this instanceof MethodCallExpr;
    }
}
