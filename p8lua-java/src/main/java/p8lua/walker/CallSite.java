package p8lua.walker;

import p8lua.ast.Lexeme;
import p8lua.ast.expr.Args;
import p8lua.ast.expr.CallExpr;
import p8lua.ast.expr.Expr;
import p8lua.ast.expr.MethodCallExpr;
import p8lua.ast.expr.VarExpr;

import java.util.List;

/**
 * A call as seen by {@link AstVisitor#visitCall}.
 *
 * @param call   the call or method call expression
 * @param callee the called expression, or the receiver of a method call
 * @param method the method name, null for plain calls
 */
public record CallSite(Expr call, Expr callee, Lexeme method, Args args) {

    public static CallSite of(Expr call) {
        if (call instanceof CallExpr c) return new CallSite(c, c.callee(), null, c.args());
        if (call instanceof MethodCallExpr m) return new CallSite(m, m.receiver(), m.method(), m.args());
        throw new IllegalArgumentException("Not a call: " + call.getClass().getSimpleName());
    }

    /** The argument expressions; a string or table shorthand is one argument. */
    public List<Expr> arguments() {
        return args.arguments();
    }

    /** The global or local name being called, or null for method calls and computed callees. */
    public String calleeName() {
        if (method == null && callee instanceof VarExpr v) return v.id();
        return null;
    }
}
