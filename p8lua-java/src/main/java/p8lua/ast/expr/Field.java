package p8lua.ast.expr;

import p8lua.ast.Lexeme;
import p8lua.ast.Node;

/** A table constructor field. */
public sealed interface Field extends Node permits Field.Positional, Field.Named, Field.Keyed {

    Expr value();

    /** {@code value} */
    record Positional(Expr value) implements Field {}

    /** {@code name = value} */
    record Named(Lexeme name, Lexeme eq, Expr value) implements Field {}

    /** {@code [key] = value} */
    record Keyed(Lexeme open, Expr key, Lexeme close, Lexeme eq, Expr value) implements Field {}
}
