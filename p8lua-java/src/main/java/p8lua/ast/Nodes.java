package p8lua.ast;

import p8lua.ast.expr.*;
import p8lua.ast.stmt.*;
import p8lua.lexer.Token;

import java.util.List;

/** Position queries over the tree. */
public final class Nodes {
    private Nodes() {}

    /**
     * The first lexeme of a node in source order, or null for an empty chunk.
     */
    public static Lexeme firstLexeme(Node node) {
        if (node instanceof Chunk c) {
            return c.statements().isEmpty() ? null : firstLexeme(c.statements().get(0));
        }

        // statements
        if (node instanceof AssignStmt s) return firstLexeme(s.targets().vars().get(0));
        if (node instanceof CallStmt s) return firstLexeme(s.call());
        if (node instanceof DoStmt s) return s.doKw();
        if (node instanceof WhileStmt s) return s.whileKw();
        if (node instanceof RepeatStmt s) return s.repeatKw();
        if (node instanceof IfStmt s) return s.branches().get(0).keyword();
        if (node instanceof IfStmt.Branch b) return b.keyword();
        if (node instanceof ForNumStmt s) return s.forKw();
        if (node instanceof ForInStmt s) return s.forKw();
        if (node instanceof FunctionStmt s) return s.functionKw();
        if (node instanceof LocalFunctionStmt s) return s.localKw();
        if (node instanceof LocalAssignStmt s) return s.localKw();
        if (node instanceof BreakStmt s) return s.breakKw();
        if (node instanceof ReturnStmt s) return s.returnKw();
        if (node instanceof GotoStmt s) return s.gotoKw();
        if (node instanceof LabelStmt s) return s.label();
        if (node instanceof EmptyStmt s) return s.semicolon();
        if (node instanceof PrintStmt s) return s.question();

        // expressions
        if (node instanceof ValueExpr e) return e.value();
        if (node instanceof VarargExpr e) return e.dots();
        if (node instanceof BinaryExpr e) return firstLexeme(e.left());
        if (node instanceof UnaryExpr e) return e.opToken();
        if (node instanceof ParenExpr e) return e.open();
        if (node instanceof VarExpr e) return e.name();
        if (node instanceof IndexExpr e) return firstLexeme(e.prefix());
        if (node instanceof FieldAccessExpr e) return firstLexeme(e.prefix());
        if (node instanceof CallExpr e) return firstLexeme(e.callee());
        if (node instanceof MethodCallExpr e) return firstLexeme(e.receiver());
        if (node instanceof FunctionExpr e) return e.functionKw();
        if (node instanceof TableExpr e) return e.open();

        // the rest
        if (node instanceof Field.Positional f) return firstLexeme(f.value());
        if (node instanceof Field.Named f) return f.name();
        if (node instanceof Field.Keyed f) return f.open();
        if (node instanceof Args.Paren a) return a.open();
        if (node instanceof Args.Table a) return a.table().open();
        if (node instanceof Args.Str a) return a.string();
        if (node instanceof VarList l) return firstLexeme(l.vars().get(0));
        if (node instanceof ExpList l) return firstLexeme(l.exps().get(0));
        if (node instanceof NameList l) return l.names().get(0);
        if (node instanceof FunctionName n) return n.path().get(0);
        if (node instanceof FunctionBody b) return b.open();

        throw new IllegalArgumentException("Unknown node: " + node.getClass().getSimpleName());
    }

    /** The whitespace and comments preceding a node. */
    public static List<Token> leadingTrivia(Node node) {
        Lexeme l = firstLexeme(node);
        return l == null ? List.of() : l.trivia();
    }
}
