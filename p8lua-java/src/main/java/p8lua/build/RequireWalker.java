package p8lua.build;

import p8lua.ast.expr.Expr;
import p8lua.ast.expr.Field;
import p8lua.ast.expr.TableExpr;
import p8lua.ast.expr.ValueExpr;
import p8lua.ast.expr.VarExpr;
import p8lua.lexer.Token;
import p8lua.walker.AstVisitor;
import p8lua.walker.CallSite;
import p8lua.walker.VisitAction;

import java.util.List;
import java.util.function.Consumer;

/** Collects the {@code require()} calls of a program, checking their arguments. */
public final class RequireWalker implements AstVisitor<RequireCall> {

    public static final String REQUIRE = "require";
    public static final String GAME_LOOP_OPTION = "use_game_loop";

    @Override
    public VisitAction visitCall(CallSite call, Consumer<RequireCall> out) {
        if (!REQUIRE.equals(call.calleeName())) return VisitAction.proceed();

        Token at = ((VarExpr) call.callee()).name().token();
        List<Expr> args = call.arguments();
        if (args.size() < 1 || args.size() > 2) {
            throw new ModuleBuildException("require() has " + args.size() + " args, should have 1 or 2", at);
        }
        if (!(args.get(0) instanceof ValueExpr path) || !path.isString()) {
            throw new ModuleBuildException("require() first argument must be a string literal", at);
        }

        boolean useGameLoop = false;
        if (args.size() == 2) {
            if (!(args.get(1) instanceof TableExpr options)) {
                throw new ModuleBuildException("require() second argument must be a table literal", at);
            }
            useGameLoop = gameLoopOption(options, at);
        }

        out.accept(new RequireCall(path.stringValue(), useGameLoop, at));
        return VisitAction.proceed();
    }

    /** {@code {use_game_loop=true}} or {@code {use_game_loop=false}}; nothing else is accepted. */
    private static boolean gameLoopOption(TableExpr options, Token at) {
        if (options.fields().size() == 1 &&
                options.fields().get(0) instanceof Field.Named f &&
                f.name().text().equals(GAME_LOOP_OPTION) &&
                f.value() instanceof ValueExpr v &&
                (v.value().text().equals("true") || v.value().text().equals("false"))) {
            return v.value().text().equals("true");
        }
        throw new ModuleBuildException("Invalid require() options; did you mean {use_game_loop=true} ?", at);
    }
}
