package p8lua.ast.expr;

import p8lua.ast.Lexeme;

import java.util.List;

/**
 * A table constructor. {@code separators} holds the {@code ,} or {@code ;} after each
 * field, so it is as long as {@code fields} when a trailing separator is present and
 * one shorter otherwise.
 */
public record TableExpr(Lexeme open, List<Field> fields, List<Lexeme> separators, Lexeme close) implements Expr {

    public TableExpr {
        fields = List.copyOf(fields);
        separators = List.copyOf(separators);
    }
}
