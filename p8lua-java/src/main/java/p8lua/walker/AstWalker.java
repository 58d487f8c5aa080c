package p8lua.walker;

import p8lua.ast.Chunk;
import p8lua.ast.ExpList;
import p8lua.ast.FunctionBody;
import p8lua.ast.Lexeme;
import p8lua.ast.Node;
import p8lua.ast.VarList;
import p8lua.ast.expr.*;
import p8lua.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal driving an {@link AstVisitor}.
 *
 * <p>Statements are visited in source order and the parts of each node in grammar
 * order. When a visitor replaces a node, the walker continues into the replacement's
 * children, not the original's. Since the tree is immutable, a changed child rebuilds
 * its parents up to the root; subtrees without changes keep their identity.
 */
public final class AstWalker<R> {

    private record Step(Node node, boolean descend, boolean removed) {}

    private final AstVisitor<R> visitor;
    private final Consumer<R> out;
    private boolean stopped;

    private AstWalker(AstVisitor<R> visitor, Consumer<R> out) {
        this.visitor = visitor;
        this.out = out;
    }

    /** Walks {@code root} and returns everything the visitor produced, in visit order. */
    public static <R> List<R> collect(Chunk root, AstVisitor<R> visitor) {
        List<R> results = new ArrayList<>();
        new AstWalker<>(visitor, results::add).chunk(root);
        return results;
    }

    /** Walks {@code root} applying the visitor's actions and returns the resulting tree. */
    public static <R> Chunk transform(Chunk root, AstVisitor<R> visitor) {
        return transform(root, visitor, r -> { });
    }

    public static <R> Chunk transform(Chunk root, AstVisitor<R> visitor, Consumer<R> out) {
        return new AstWalker<>(visitor, out).chunk(root);
    }

    // ---------- actions ----------

    private Step apply(VisitPoint point, Node node, VisitAction action) {
        return switch (action.kind()) {
            case PROCEED -> new Step(node, true, false);
            case SKIP_CHILDREN -> new Step(node, false, false);
            case REPLACE -> new Step(action.replacement(), true, false);
            case REMOVE -> {
                if (point != VisitPoint.STATEMENT) {
                    throw new IllegalStateException("remove() is only valid for statements, not at " + point);
                }
                yield new Step(null, false, true);
            }
            case STOP -> {
                stopped = true;
                yield new Step(node, false, false);
            }
        };
    }

    private Step visit(VisitPoint point, Node node) {
        return apply(point, node, visitor.visit(point, node, out));
    }

    private static <T> T cast(Node node, Class<T> type, VisitPoint point) {
        if (!type.isInstance(node)) {
            throw new IllegalStateException("Cannot put " + node.getClass().getSimpleName() + " at " + point);
        }
        return type.cast(node);
    }

    // ---------- blocks and statements ----------

    private Chunk chunk(Chunk c) {
        if (stopped) return c;
        Step step = visit(VisitPoint.BLOCK, c);
        Chunk target = cast(step.node(), Chunk.class, VisitPoint.BLOCK);
        if (!step.descend()) return target;

        List<Stmt> result = new ArrayList<>();
        boolean changed = target != c;
        for (Stmt s : target.statements()) {
            Stmt n = stmt(s);
            if (n != s) changed = true;
            if (n != null) result.add(n);
        }
        return changed ? target.withStatements(result) : target;
    }

    /** The statement to keep in place of {@code s}, or null if it was removed. */
    private Stmt stmt(Stmt s) {
        if (stopped) return s;
        Step step = visit(VisitPoint.STATEMENT, s);
        if (step.removed()) return null;
        Stmt target = cast(step.node(), Stmt.class, VisitPoint.STATEMENT);
        return step.descend() ? stmtChildren(target) : target;
    }

    private Stmt stmtChildren(Stmt s) {
        if (s instanceof AssignStmt a) {
            VarList v = vars(a.targets());
            ExpList e = exps(a.values());
            return v == a.targets() && e == a.values() ? a : new AssignStmt(v, a.op(), e);
        }
        if (s instanceof CallStmt c) {
            Expr e = expr(c.call());
            return e == c.call() ? c : new CallStmt(e);
        }
        if (s instanceof DoStmt d) {
            Chunk b = chunk(d.body());
            return b == d.body() ? d : new DoStmt(d.doKw(), b, d.endKw());
        }
        if (s instanceof WhileStmt w) {
            Expr cond = expr(w.condition());
            Chunk b = chunk(w.body());
            return cond == w.condition() && b == w.body() ? w
                    : new WhileStmt(w.whileKw(), cond, w.doKw(), b, w.endKw());
        }
        if (s instanceof RepeatStmt r) {
            Chunk b = chunk(r.body());
            Expr cond = expr(r.condition());
            return cond == r.condition() && b == r.body() ? r
                    : new RepeatStmt(r.repeatKw(), b, r.untilKw(), cond);
        }
        if (s instanceof IfStmt i) {
            List<IfStmt.Branch> branches = new ArrayList<>();
            boolean changed = false;
            for (IfStmt.Branch br : i.branches()) {
                Expr cond = expr(br.condition());
                Chunk b = chunk(br.body());
                if (cond != br.condition() || b != br.body()) {
                    changed = true;
                    branches.add(new IfStmt.Branch(br.keyword(), cond, br.thenKw(), b));
                } else {
                    branches.add(br);
                }
            }
            return changed ? new IfStmt(branches, i.endKw()) : i;
        }
        if (s instanceof ForNumStmt f) {
            Expr start = expr(f.start());
            Expr limit = expr(f.limit());
            Expr step = expr(f.step());
            Chunk b = chunk(f.body());
            if (start == f.start() && limit == f.limit() && step == f.step() && b == f.body()) return f;
            return new ForNumStmt(f.forKw(), f.name(), f.eq(), start, f.limitComma(), limit,
                    f.stepComma(), step, f.doKw(), b, f.endKw());
        }
        if (s instanceof ForInStmt f) {
            ExpList e = exps(f.exps());
            Chunk b = chunk(f.body());
            return e == f.exps() && b == f.body() ? f
                    : new ForInStmt(f.forKw(), f.names(), f.inKw(), e, f.doKw(), b, f.endKw());
        }
        if (s instanceof FunctionStmt f) {
            FunctionBody b = function(f.body());
            return b == f.body() ? f : new FunctionStmt(f.functionKw(), f.name(), b);
        }
        if (s instanceof LocalFunctionStmt f) {
            FunctionBody b = function(f.body());
            return b == f.body() ? f : new LocalFunctionStmt(f.localKw(), f.functionKw(), f.name(), b);
        }
        if (s instanceof LocalAssignStmt l) {
            ExpList e = exps(l.values());
            return e == l.values() ? l : new LocalAssignStmt(l.localKw(), l.names(), l.eq(), e);
        }
        if (s instanceof ReturnStmt r) {
            ExpList e = exps(r.values());
            return e == r.values() ? r : new ReturnStmt(r.returnKw(), e);
        }
        if (s instanceof PrintStmt p) {
            ExpList e = exps(p.args());
            return e == p.args() ? p : new PrintStmt(p.question(), e);
        }
        // break, goto, label, empty: no children
        return s;
    }

    // ---------- expressions ----------

    private Expr expr(Expr e) {
        if (e == null || stopped) return e;
        Step step = visit(VisitPoint.EXPRESSION, e);
        Expr target = cast(step.node(), Expr.class, VisitPoint.EXPRESSION);
        if (!step.descend()) return target;

        if (target.isCall()) {
            Step call = apply(VisitPoint.EXPRESSION, target, visitor.visitCall(CallSite.of(target), out));
            target = cast(call.node(), Expr.class, VisitPoint.EXPRESSION);
            if (!call.descend()) return target;
        }
        return exprChildren(target);
    }

    private Expr exprChildren(Expr e) {
        if (e instanceof BinaryExpr b) {
            Expr l = expr(b.left());
            Expr r = expr(b.right());
            return l == b.left() && r == b.right() ? b : new BinaryExpr(l, b.op(), b.opToken(), r);
        }
        if (e instanceof UnaryExpr u) {
            Expr o = expr(u.operand());
            return o == u.operand() ? u : new UnaryExpr(u.op(), u.opToken(), o);
        }
        if (e instanceof ParenExpr p) {
            Expr i = expr(p.inner());
            return i == p.inner() ? p : new ParenExpr(p.open(), i, p.close());
        }
        if (e instanceof IndexExpr i) {
            Expr prefix = expr(i.prefix());
            Expr index = expr(i.index());
            return prefix == i.prefix() && index == i.index() ? i
                    : new IndexExpr(prefix, i.open(), index, i.close());
        }
        if (e instanceof FieldAccessExpr f) {
            Expr prefix = expr(f.prefix());
            return prefix == f.prefix() ? f : new FieldAccessExpr(prefix, f.dot(), f.name());
        }
        if (e instanceof CallExpr c) {
            Expr callee = expr(c.callee());
            Args args = args(c.args());
            return callee == c.callee() && args == c.args() ? c : new CallExpr(callee, args);
        }
        if (e instanceof MethodCallExpr m) {
            Expr receiver = expr(m.receiver());
            Args args = args(m.args());
            return receiver == m.receiver() && args == m.args() ? m
                    : new MethodCallExpr(receiver, m.colon(), m.method(), args);
        }
        if (e instanceof FunctionExpr f) {
            FunctionBody b = function(f.body());
            return b == f.body() ? f : new FunctionExpr(f.functionKw(), b);
        }
        if (e instanceof TableExpr t) {
            List<Field> fields = new ArrayList<>();
            boolean changed = false;
            for (Field f : t.fields()) {
                Field n = field(f);
                if (n != f) changed = true;
                fields.add(n);
            }
            return changed ? new TableExpr(t.open(), fields, t.separators(), t.close()) : t;
        }
        // values, varargs and names have no children
        return e;
    }

    /** Shorthand arguments are visited as the expression they stand for. */
    private Args args(Args a) {
        if (a instanceof Args.Paren p) {
            ExpList e = exps(p.exps());
            return e == p.exps() ? p : new Args.Paren(p.open(), e, p.close());
        }
        if (a instanceof Args.Table t) {
            Expr n = expr(t.table());
            if (n == t.table()) return t;
            return n instanceof TableExpr table ? new Args.Table(table) : parenthesized(n);
        }
        Args.Str s = (Args.Str) a;
        ValueExpr value = new ValueExpr(s.string());
        Expr n = expr(value);
        if (n == value) return s;
        if (n instanceof ValueExpr v && v.isString()) return new Args.Str(v.value());
        return parenthesized(n);
    }

    private static Args parenthesized(Expr e) {
        return new Args.Paren(Lexeme.symbol("("), ExpList.of(e), Lexeme.symbol(")"));
    }

    private Field field(Field f) {
        if (stopped) return f;
        Step step = visit(VisitPoint.FIELD, f);
        Field target = cast(step.node(), Field.class, VisitPoint.FIELD);
        if (!step.descend()) return target;

        if (target instanceof Field.Positional p) {
            Expr v = expr(p.value());
            return v == p.value() ? p : new Field.Positional(v);
        }
        if (target instanceof Field.Named n) {
            Expr v = expr(n.value());
            return v == n.value() ? n : new Field.Named(n.name(), n.eq(), v);
        }
        Field.Keyed k = (Field.Keyed) target;
        Expr key = expr(k.key());
        Expr v = expr(k.value());
        return key == k.key() && v == k.value() ? k : new Field.Keyed(k.open(), key, k.close(), k.eq(), v);
    }

    private FunctionBody function(FunctionBody b) {
        if (stopped) return b;
        Step step = visit(VisitPoint.FUNCTION, b);
        FunctionBody target = cast(step.node(), FunctionBody.class, VisitPoint.FUNCTION);
        if (!step.descend()) return target;
        Chunk body = chunk(target.body());
        return body == target.body() ? target : target.withBody(body);
    }

    // ---------- lists ----------

    private ExpList exps(ExpList l) {
        if (l == null) return null;
        List<Expr> result = new ArrayList<>();
        boolean changed = false;
        for (Expr e : l.exps()) {
            Expr n = expr(e);
            if (n != e) changed = true;
            result.add(n);
        }
        return changed ? new ExpList(result, l.commas()) : l;
    }

    private VarList vars(VarList l) {
        List<Expr> result = new ArrayList<>();
        boolean changed = false;
        for (Expr e : l.vars()) {
            Expr n = expr(e);
            if (n != e) changed = true;
            result.add(n);
        }
        return changed ? new VarList(result, l.commas()) : l;
    }
}
