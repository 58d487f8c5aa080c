package p8lua.walker;

import org.junit.jupiter.api.Test;
import p8lua.ast.Chunk;
import p8lua.ast.Lexeme;
import p8lua.ast.Node;
import p8lua.ast.expr.Field;
import p8lua.ast.expr.ValueExpr;
import p8lua.ast.expr.VarExpr;
import p8lua.ast.stmt.AssignStmt;
import p8lua.ast.stmt.CallStmt;
import p8lua.ast.stmt.Stmt;
import p8lua.lexer.Lexer;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;
import p8lua.parser.Parser;
import p8lua.writer.AstEchoWriter;

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class AstWalkerTest {

    private static Chunk parse(String src) {
        return Parser.parse(Lexer.tokenize(src));
    }

    private static String render(Chunk root) {
        return new AstEchoWriter().renderToString(List.of(), root);
    }

    /** Records "POINT:NodeType" for every visit. */
    private static final AstVisitor<String> TRACE = new AstVisitor<>() {
        @Override
        public VisitAction visit(VisitPoint point, Node node, Consumer<String> out) {
            out.accept(point + ":" + node.getClass().getSimpleName());
            return VisitAction.proceed();
        }
    };

    /** Records the names of visited variables. */
    private static final AstVisitor<String> NAMES = new AstVisitor<>() {
        @Override
        public VisitAction visit(VisitPoint point, Node node, Consumer<String> out) {
            if (node instanceof VarExpr v) out.accept(v.id());
            return VisitAction.proceed();
        }
    };

    @Test
    void visits_in_pre_order() {
        var trace = AstWalker.collect(parse("a = b + c"), TRACE);
        assertEquals(List.of(
                "BLOCK:Chunk",
                "STATEMENT:AssignStmt",
                "EXPRESSION:VarExpr",
                "EXPRESSION:BinaryExpr",
                "EXPRESSION:VarExpr",
                "EXPRESSION:VarExpr"
        ), trace);
    }

    @Test
    void visits_statements_in_source_order_and_descends_into_functions() {
        var names = AstWalker.collect(parse("""
                x = 1
                function f(p) return y end
                if z then w() end
                t = {k = v, [i] = j}
                """), NAMES);
        assertEquals(List.of("x", "y", "z", "w", "t", "v", "i", "j"), names);
    }

    @Test
    void function_and_field_points() {
        var trace = AstWalker.collect(parse("f = function() end t = {1}"), TRACE);
        assertTrue(trace.contains("FUNCTION:FunctionBody"));
        assertTrue(trace.contains("FIELD:Positional"));
    }

    @Test
    void skip_children_hides_subtree() {
        var names = AstWalker.collect(parse("a = b do c = d end"), new AstVisitor<String>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<String> out) {
                if (node instanceof VarExpr v) out.accept(v.id());
                if (point == VisitPoint.BLOCK && ((Chunk) node).statements().size() == 1) {
                    return VisitAction.skipChildren();
                }
                return VisitAction.proceed();
            }
        });
        assertEquals(List.of("a", "b"), names);
    }

    @Test
    void stop_ends_the_walk() {
        var names = AstWalker.collect(parse("a = 1 b = 2 c = 3"), new AstVisitor<String>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<String> out) {
                if (node instanceof VarExpr v) {
                    out.accept(v.id());
                    if (v.id().equals("b")) return VisitAction.stop();
                }
                return VisitAction.proceed();
            }
        });
        assertEquals(List.of("a", "b"), names);
    }

    @Test
    void replace_expression_rebuilds_parents_only() {
        Chunk root = parse("a = 1\nb = x\n");
        Chunk out = AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                if (node instanceof VarExpr v && v.id().equals("x")) {
                    return VisitAction.replace(new VarExpr(new Lexeme(Token.name("y"), v.name().trivia())));
                }
                return VisitAction.proceed();
            }
        });
        assertNotSame(root, out);
        assertSame(root.statements().get(0), out.statements().get(0));
        assertNotSame(root.statements().get(1), out.statements().get(1));
        assertEquals("a = 1\nb = y\n", render(out));
    }

    @Test
    void unchanged_walk_keeps_identity() {
        Chunk root = parse("a = 1 if b then c() end");
        assertSame(root, AstWalker.transform(root, TRACE));
    }

    @Test
    void replacement_children_are_walked() {
        Chunk root = parse("a = 1");
        var seen = AstWalker.collect(root, new AstVisitor<String>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<String> out) {
                if (node instanceof ValueExpr) {
                    return VisitAction.replace(new VarExpr(Lexeme.name("q")));
                }
                if (node instanceof VarExpr v) out.accept(v.id());
                return VisitAction.proceed();
            }
        });
        // the replacement itself is not revisited, only its children
        assertEquals(List.of("a"), seen);
    }

    @Test
    void remove_statement() {
        Chunk root = parse("a = 1\nprint(a)\nb = 2\n");
        Chunk out = AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                return node instanceof CallStmt ? VisitAction.remove() : VisitAction.proceed();
            }
        });
        assertEquals(2, out.statements().size());
        assertEquals("a = 1\nb = 2\n", render(out));
    }

    @Test
    void remove_outside_statement_fails() {
        Chunk root = parse("a = 1");
        assertThrows(IllegalStateException.class, () -> AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                return point == VisitPoint.EXPRESSION ? VisitAction.remove() : VisitAction.proceed();
            }
        }));
    }

    @Test
    void replacement_of_wrong_kind_fails() {
        Chunk root = parse("a = 1");
        assertThrows(IllegalStateException.class, () -> AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                if (node instanceof AssignStmt) return VisitAction.replace(new VarExpr(Lexeme.name("x")));
                return VisitAction.proceed();
            }
        }));
    }

    @Test
    void call_sites_resolve_shorthand_arguments() {
        var calls = AstWalker.collect(parse("f'a' g{1} h(1, 2) o:m(3)"), new AstVisitor<CallSite>() {
            @Override
            public VisitAction visitCall(CallSite call, Consumer<CallSite> out) {
                out.accept(call);
                return VisitAction.proceed();
            }
        });
        assertEquals(4, calls.size());
        assertEquals("f", calls.get(0).calleeName());
        assertEquals(1, calls.get(0).arguments().size());
        assertTrue(((ValueExpr) calls.get(0).arguments().get(0)).isString());
        assertEquals(1, calls.get(1).arguments().size());
        assertEquals(2, calls.get(2).arguments().size());
        assertNull(calls.get(3).calleeName());
        assertEquals("m", calls.get(3).method().text());
    }

    @Test
    void string_argument_can_be_replaced() {
        Chunk root = parse("f'a'\n");
        Chunk out = AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                if (node instanceof ValueExpr v && v.isString()) {
                    return VisitAction.replace(new ValueExpr(Lexeme.synthetic(TokenKind.NUMBER, "7")));
                }
                return VisitAction.proceed();
            }
        });
        assertEquals("f(7)\n", render(out));
    }

    @Test
    void field_point_allows_replacing_fields() {
        Chunk root = parse("t = {a = 1}");
        Chunk out = AstWalker.transform(root, new AstVisitor<Void>() {
            @Override
            public VisitAction visit(VisitPoint point, Node node, Consumer<Void> sink) {
                if (node instanceof Field.Named n) {
                    return VisitAction.replace(new Field.Positional(n.value()));
                }
                return VisitAction.proceed();
            }
        });
        Stmt s = out.statements().get(0);
        assertInstanceOf(AssignStmt.class, s);
        assertEquals("t = { 1}", render(out));
    }
}
