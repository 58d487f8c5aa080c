package p8lua.ast;

import p8lua.ast.expr.Expr;

import java.util.List;

/** Assignment targets; {@code commas} has one entry less than {@code vars}. */
public record VarList(List<Expr> vars, List<Lexeme> commas) implements Node {

    public VarList {
        vars = List.copyOf(vars);
        commas = List.copyOf(commas);
    }

    public static VarList of(List<Expr> vars) {
        return new VarList(vars, ListSupport.commas(vars.size()));
    }
}
