package p8lua.ast.expr;

import p8lua.ast.Lexeme;

public record UnaryExpr(
        Operator op,
        Lexeme opToken,
        Expr operand
) implements Expr {

    /** Binds tighter than every binary operator except {@code ^}. */
    public static final int PRECEDENCE = 11;

    public enum Operator {
        NOT("not"), LEN("#"), NEG("-"), BNOT("~"),
        PEEK("@"), PEEK2("%"), PEEK4("$");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            return null;
        }
    }
}
