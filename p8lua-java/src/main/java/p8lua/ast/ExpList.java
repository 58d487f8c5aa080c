package p8lua.ast;

import p8lua.ast.expr.Expr;

import java.util.List;

public record ExpList(List<Expr> exps, List<Lexeme> commas) implements Node {

    public ExpList {
        exps = List.copyOf(exps);
        commas = List.copyOf(commas);
    }

    public static ExpList of(List<Expr> exps) {
        return new ExpList(exps, ListSupport.commas(exps.size()));
    }

    public static ExpList of(Expr... exps) {
        return of(List.of(exps));
    }

    public int size() {
        return exps.size();
    }
}
