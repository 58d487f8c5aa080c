package p8lua.ast.expr;

import p8lua.ast.Lexeme;

import java.util.HashMap;
import java.util.Map;

public record BinaryExpr(
        Expr left,
        Operator op,
        Lexeme opToken,
        Expr right
) implements Expr {

    /** Binary operators with their binding power; higher binds tighter. */
    public enum Operator {
        OR("or", 1), AND("and", 2),
        LT("<", 3), GT(">", 3), LE("<=", 3), GE(">=", 3), NE("~=", 3), NE_ALT("!=", 3), EQ("==", 3),
        BOR("|", 4),
        BXOR("^^", 5),
        BAND("&", 6),
        SHL("<<", 7), SHR(">>", 7), LSHR(">>>", 7), ROTL("<<>", 7), ROTR(">><", 7),
        CONCAT("..", 8),
        ADD("+", 9), SUB("-", 9),
        MUL("*", 10), DIV("/", 10), IDIV("\\", 10), MOD("%", 10),
        POW("^", 12);

        private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

        static {
            for (Operator op : values()) BY_SYMBOL.put(op.symbol, op);
        }

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean rightAssociative() {
            return this == CONCAT || this == POW;
        }

        /** The operator spelled {@code symbol}, or null. */
        public static Operator fromSymbol(String symbol) {
            return BY_SYMBOL.get(symbol);
        }
    }
}
