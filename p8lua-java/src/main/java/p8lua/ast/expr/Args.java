package p8lua.ast.expr;

import p8lua.ast.ExpList;
import p8lua.ast.Lexeme;
import p8lua.ast.Node;

import java.util.List;

/** Call arguments: {@code (a, b)}, a table constructor or a string literal. */
public sealed interface Args extends Node permits Args.Paren, Args.Table, Args.Str {

    /** The argument expressions; the shorthand forms yield exactly one. */
    List<Expr> arguments();

    /** @param exps null for {@code ()} */
    record Paren(Lexeme open, ExpList exps, Lexeme close) implements Args {
        @Override
        public List<Expr> arguments() {
            return exps == null ? List.of() : exps.exps();
        }
    }

    record Table(TableExpr table) implements Args {
        @Override
        public List<Expr> arguments() {
            return List.of(table);
        }
    }

    record Str(Lexeme string) implements Args {
        @Override
        public List<Expr> arguments() {
            return List.of(new ValueExpr(string));
        }
    }
}
