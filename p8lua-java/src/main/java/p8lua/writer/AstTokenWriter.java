package p8lua.writer;

import p8lua.ast.Chunk;
import p8lua.ast.ExpList;
import p8lua.ast.FunctionBody;
import p8lua.ast.FunctionName;
import p8lua.ast.Lexeme;
import p8lua.ast.NameList;
import p8lua.ast.expr.*;
import p8lua.ast.stmt.*;
import p8lua.lexer.Token;

import java.util.List;

/**
 * Walks a tree in source order and hands every lexeme to {@link #writeLexeme}, tagged
 * with its grammatical role. Subclasses decide what to do with trivia and spacing.
 * One instance renders one program.
 */
public abstract class AstTokenWriter {

    public enum Role {
        KEYWORD, NAME, LITERAL, BINARY_OP, UNARY_OP, ASSIGN_OP,
        COMMA, SEPARATOR, OPEN, CLOSE, DOT, COLON, LABEL, VARARG
    }

    protected final StringBuilder out = new StringBuilder();

    /** Renders {@code root} and returns the text. */
    public final String write(Chunk root) {
        statements(root);
        writeTrailing(root.trailingTrivia());
        return out.toString();
    }

    protected abstract void writeLexeme(Lexeme lexeme, Role role);

    /** Trivia after the last statement of the program. */
    protected abstract void writeTrailing(List<Token> trivia);

    /** @param oneLine true for the bodies of the one-line {@code if} and {@code while} */
    protected void enterBlock(boolean oneLine) {}

    protected void exitBlock(boolean oneLine) {}

    protected void enterTable() {}

    protected void exitTable() {}

    protected void beforeStatement(Stmt s) {}

    protected void afterStatement(Stmt s) {}

    // ---------- blocks and statements ----------

    private void statements(Chunk c) {
        for (Stmt s : c.statements()) {
            beforeStatement(s);
            stmt(s);
            afterStatement(s);
        }
    }

    private void block(Chunk c, boolean oneLine) {
        enterBlock(oneLine);
        statements(c);
        exitBlock(oneLine);
    }

    private void stmt(Stmt s) {
        if (s instanceof AssignStmt a) {
            for (int i = 0; i < a.targets().vars().size(); i++) {
                if (i > 0) writeLexeme(a.targets().commas().get(i - 1), Role.COMMA);
                expr(a.targets().vars().get(i));
            }
            writeLexeme(a.op(), Role.ASSIGN_OP);
            exps(a.values());
        } else if (s instanceof CallStmt c) {
            expr(c.call());
        } else if (s instanceof DoStmt d) {
            writeLexeme(d.doKw(), Role.KEYWORD);
            block(d.body(), false);
            writeLexeme(d.endKw(), Role.KEYWORD);
        } else if (s instanceof WhileStmt w) {
            writeLexeme(w.whileKw(), Role.KEYWORD);
            expr(w.condition());
            if (w.isShort()) {
                block(w.body(), true);
            } else {
                writeLexeme(w.doKw(), Role.KEYWORD);
                block(w.body(), false);
                writeLexeme(w.endKw(), Role.KEYWORD);
            }
        } else if (s instanceof RepeatStmt r) {
            writeLexeme(r.repeatKw(), Role.KEYWORD);
            block(r.body(), false);
            writeLexeme(r.untilKw(), Role.KEYWORD);
            expr(r.condition());
        } else if (s instanceof IfStmt i) {
            for (IfStmt.Branch br : i.branches()) {
                writeLexeme(br.keyword(), Role.KEYWORD);
                if (br.condition() != null) expr(br.condition());
                if (br.thenKw() != null) writeLexeme(br.thenKw(), Role.KEYWORD);
                block(br.body(), i.isShort());
            }
            if (!i.isShort()) writeLexeme(i.endKw(), Role.KEYWORD);
        } else if (s instanceof ForNumStmt f) {
            writeLexeme(f.forKw(), Role.KEYWORD);
            writeLexeme(f.name(), Role.NAME);
            writeLexeme(f.eq(), Role.ASSIGN_OP);
            expr(f.start());
            writeLexeme(f.limitComma(), Role.COMMA);
            expr(f.limit());
            if (f.step() != null) {
                writeLexeme(f.stepComma(), Role.COMMA);
                expr(f.step());
            }
            writeLexeme(f.doKw(), Role.KEYWORD);
            block(f.body(), false);
            writeLexeme(f.endKw(), Role.KEYWORD);
        } else if (s instanceof ForInStmt f) {
            writeLexeme(f.forKw(), Role.KEYWORD);
            names(f.names());
            writeLexeme(f.inKw(), Role.KEYWORD);
            exps(f.exps());
            writeLexeme(f.doKw(), Role.KEYWORD);
            block(f.body(), false);
            writeLexeme(f.endKw(), Role.KEYWORD);
        } else if (s instanceof FunctionStmt f) {
            writeLexeme(f.functionKw(), Role.KEYWORD);
            functionName(f.name());
            function(f.body());
        } else if (s instanceof LocalFunctionStmt f) {
            writeLexeme(f.localKw(), Role.KEYWORD);
            writeLexeme(f.functionKw(), Role.KEYWORD);
            writeLexeme(f.name(), Role.NAME);
            function(f.body());
        } else if (s instanceof LocalAssignStmt l) {
            writeLexeme(l.localKw(), Role.KEYWORD);
            names(l.names());
            if (l.eq() != null) {
                writeLexeme(l.eq(), Role.ASSIGN_OP);
                exps(l.values());
            }
        } else if (s instanceof BreakStmt b) {
            writeLexeme(b.breakKw(), Role.KEYWORD);
        } else if (s instanceof ReturnStmt r) {
            writeLexeme(r.returnKw(), Role.KEYWORD);
            if (r.values() != null) exps(r.values());
        } else if (s instanceof GotoStmt g) {
            writeLexeme(g.gotoKw(), Role.KEYWORD);
            writeLexeme(g.label(), Role.NAME);
        } else if (s instanceof LabelStmt l) {
            writeLexeme(l.label(), Role.LABEL);
        } else if (s instanceof EmptyStmt e) {
            writeLexeme(e.semicolon(), Role.SEPARATOR);
        } else if (s instanceof PrintStmt p) {
            writeLexeme(p.question(), Role.KEYWORD);
            exps(p.args());
        }
    }

    private void functionName(FunctionName n) {
        for (int i = 0; i < n.path().size(); i++) {
            if (i > 0) writeLexeme(n.dots().get(i - 1), Role.DOT);
            writeLexeme(n.path().get(i), Role.NAME);
        }
        if (n.method() != null) {
            writeLexeme(n.colon(), Role.COLON);
            writeLexeme(n.method(), Role.NAME);
        }
    }

    private void function(FunctionBody b) {
        writeLexeme(b.open(), Role.OPEN);
        if (b.params() != null) names(b.params());
        if (b.varargComma() != null) writeLexeme(b.varargComma(), Role.COMMA);
        if (b.varargs() != null) writeLexeme(b.varargs(), Role.VARARG);
        writeLexeme(b.close(), Role.CLOSE);
        block(b.body(), false);
        writeLexeme(b.endKw(), Role.KEYWORD);
    }

    private void names(NameList l) {
        for (int i = 0; i < l.names().size(); i++) {
            if (i > 0) writeLexeme(l.commas().get(i - 1), Role.COMMA);
            writeLexeme(l.names().get(i), Role.NAME);
        }
    }

    private void exps(ExpList l) {
        for (int i = 0; i < l.exps().size(); i++) {
            if (i > 0) writeLexeme(l.commas().get(i - 1), Role.COMMA);
            expr(l.exps().get(i));
        }
    }

    // ---------- expressions ----------

    private void expr(Expr e) {
        if (e instanceof ValueExpr v) {
            writeLexeme(v.value(), Role.LITERAL);
        } else if (e instanceof VarargExpr v) {
            writeLexeme(v.dots(), Role.VARARG);
        } else if (e instanceof BinaryExpr b) {
            expr(b.left());
            writeLexeme(b.opToken(), Role.BINARY_OP);
            expr(b.right());
        } else if (e instanceof UnaryExpr u) {
            writeLexeme(u.opToken(), Role.UNARY_OP);
            expr(u.operand());
        } else if (e instanceof ParenExpr p) {
            writeLexeme(p.open(), Role.OPEN);
            expr(p.inner());
            writeLexeme(p.close(), Role.CLOSE);
        } else if (e instanceof VarExpr v) {
            writeLexeme(v.name(), Role.NAME);
        } else if (e instanceof IndexExpr i) {
            expr(i.prefix());
            writeLexeme(i.open(), Role.OPEN);
            expr(i.index());
            writeLexeme(i.close(), Role.CLOSE);
        } else if (e instanceof FieldAccessExpr f) {
            expr(f.prefix());
            writeLexeme(f.dot(), Role.DOT);
            writeLexeme(f.name(), Role.NAME);
        } else if (e instanceof CallExpr c) {
            expr(c.callee());
            args(c.args());
        } else if (e instanceof MethodCallExpr m) {
            expr(m.receiver());
            writeLexeme(m.colon(), Role.COLON);
            writeLexeme(m.method(), Role.NAME);
            args(m.args());
        } else if (e instanceof FunctionExpr f) {
            writeLexeme(f.functionKw(), Role.KEYWORD);
            function(f.body());
        } else if (e instanceof TableExpr t) {
            table(t);
        }
    }

    private void args(Args a) {
        if (a instanceof Args.Paren p) {
            writeLexeme(p.open(), Role.OPEN);
            if (p.exps() != null) exps(p.exps());
            writeLexeme(p.close(), Role.CLOSE);
        } else if (a instanceof Args.Table t) {
            table(t.table());
        } else if (a instanceof Args.Str s) {
            writeLexeme(s.string(), Role.LITERAL);
        }
    }

    private void table(TableExpr t) {
        writeLexeme(t.open(), Role.OPEN);
        enterTable();
        for (int i = 0; i < t.fields().size(); i++) {
            field(t.fields().get(i));
            if (i < t.separators().size()) {
                Lexeme sep = t.separators().get(i);
                writeLexeme(sep, ",".equals(sep.text()) ? Role.COMMA : Role.SEPARATOR);
            }
        }
        exitTable();
        writeLexeme(t.close(), Role.CLOSE);
    }

    private void field(Field f) {
        if (f instanceof Field.Named n) {
            writeLexeme(n.name(), Role.NAME);
            writeLexeme(n.eq(), Role.ASSIGN_OP);
        } else if (f instanceof Field.Keyed k) {
            writeLexeme(k.open(), Role.OPEN);
            expr(k.key());
            writeLexeme(k.close(), Role.CLOSE);
            writeLexeme(k.eq(), Role.ASSIGN_OP);
        }
        expr(f.value());
    }
}
