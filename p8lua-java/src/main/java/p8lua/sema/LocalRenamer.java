package p8lua.sema;

import p8lua.ast.Chunk;
import p8lua.ast.ExpList;
import p8lua.ast.FunctionBody;
import p8lua.ast.Lexeme;
import p8lua.ast.expr.*;
import p8lua.ast.stmt.*;
import p8lua.lexer.Dialect;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Computes short names for every local variable, parameter and local function.
 *
 * <p>A first pass finds every name used as a global. The second pass walks the scopes
 * again and gives each declaration the first generated name that is not a keyword,
 * not {@code self}, not a global and not taken by a local visible at that point.
 * Locals in disjoint scopes may therefore share a name. Table fields, method names
 * and labels are never renamed.
 */
public final class LocalRenamer {

    private final Set<String> globals = new HashSet<>();
    private final Map<Lexeme, String> renames = new IdentityHashMap<>();
    private SymbolTable table;
    private boolean assigning;

    private LocalRenamer() {}

    /** The new spelling of each renamed name lexeme, keyed by identity. */
    public static Map<Lexeme, String> rename(Chunk root) {
        LocalRenamer r = new LocalRenamer();
        r.run(root, false);
        r.run(root, true);
        return r.renames;
    }

    /** Names the program reads or writes as globals. */
    public static Set<String> globalNames(Chunk root) {
        LocalRenamer r = new LocalRenamer();
        r.run(root, false);
        return r.globals;
    }

    private void run(Chunk root, boolean assign) {
        this.assigning = assign;
        this.table = new SymbolTable();
        statements(root);
    }

    private boolean taken(String candidate) {
        return Dialect.isKeyword(candidate) ||
                candidate.equals("self") ||
                globals.contains(candidate) ||
                table.inUse(candidate);
    }

    private void declare(Lexeme name) {
        String newName = null;
        if (assigning) {
            newName = NameGenerator.first(this::taken);
            renames.put(name, newName);
        }
        table.define(new LocalSymbol(name.text(), newName));
    }

    private void reference(Lexeme name) {
        LocalSymbol sym = table.lookup(name.text());
        if (sym == null) {
            globals.add(name.text());
        } else if (assigning) {
            renames.put(name, sym.newName());
        }
    }

    // ---------- blocks ----------
    private void block(Chunk c) {
        table.push();
        statements(c);
        table.pop();
    }

    private void statements(Chunk c) {
        for (Stmt s : c.statements()) stmt(s);
    }

    private void function(FunctionBody b) {
        table.push();
        if (b.params() != null) {
            for (Lexeme p : b.params().names()) declare(p);
        }
        block(b.body());
        table.pop();
    }

    // ---------- statements ----------
    private void stmt(Stmt s) {
        if (s instanceof LocalAssignStmt l) {
            // the initializers still see the names being shadowed
            exps(l.values());
            for (Lexeme n : l.names().names()) declare(n);
        } else if (s instanceof LocalFunctionStmt f) {
            declare(f.name());
            function(f.body());
        } else if (s instanceof FunctionStmt f) {
            reference(f.name().path().get(0));
            function(f.body());
        } else if (s instanceof AssignStmt a) {
            for (Expr v : a.targets().vars()) expr(v);
            exps(a.values());
        } else if (s instanceof CallStmt c) {
            expr(c.call());
        } else if (s instanceof DoStmt d) {
            block(d.body());
        } else if (s instanceof WhileStmt w) {
            expr(w.condition());
            block(w.body());
        } else if (s instanceof RepeatStmt r) {
            // the condition is inside the loop body's scope
            table.push();
            statements(r.body());
            expr(r.condition());
            table.pop();
        } else if (s instanceof IfStmt i) {
            for (IfStmt.Branch br : i.branches()) {
                if (br.condition() != null) expr(br.condition());
                block(br.body());
            }
        } else if (s instanceof ForNumStmt f) {
            expr(f.start());
            expr(f.limit());
            if (f.step() != null) expr(f.step());
            table.push();
            declare(f.name());
            block(f.body());
            table.pop();
        } else if (s instanceof ForInStmt f) {
            exps(f.exps());
            table.push();
            for (Lexeme n : f.names().names()) declare(n);
            block(f.body());
            table.pop();
        } else if (s instanceof ReturnStmt r) {
            exps(r.values());
        } else if (s instanceof PrintStmt p) {
            exps(p.args());
        }
    }

    // ---------- expressions ----------
    private void exps(ExpList l) {
        if (l == null) return;
        for (Expr e : l.exps()) expr(e);
    }

    private void expr(Expr e) {
        if (e instanceof VarExpr v) {
            reference(v.name());
        } else if (e instanceof BinaryExpr b) {
            expr(b.left());
            expr(b.right());
        } else if (e instanceof UnaryExpr u) {
            expr(u.operand());
        } else if (e instanceof ParenExpr p) {
            expr(p.inner());
        } else if (e instanceof IndexExpr i) {
            expr(i.prefix());
            expr(i.index());
        } else if (e instanceof FieldAccessExpr f) {
            expr(f.prefix());
        } else if (e instanceof CallExpr c) {
            expr(c.callee());
            args(c.args());
        } else if (e instanceof MethodCallExpr m) {
            expr(m.receiver());
            args(m.args());
        } else if (e instanceof FunctionExpr f) {
            function(f.body());
        } else if (e instanceof TableExpr t) {
            table(t);
        }
    }

    private void args(Args a) {
        if (a instanceof Args.Paren p) exps(p.exps());
        else if (a instanceof Args.Table t) table(t.table());
    }

    private void table(TableExpr t) {
        for (Field f : t.fields()) {
            if (f instanceof Field.Keyed k) expr(k.key());
            expr(f.value());
        }
    }
}
