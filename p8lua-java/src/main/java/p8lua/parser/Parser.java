package p8lua.parser;

import p8lua.ast.Chunk;
import p8lua.ast.ExpList;
import p8lua.ast.FunctionBody;
import p8lua.ast.FunctionName;
import p8lua.ast.Lexeme;
import p8lua.ast.NameList;
import p8lua.ast.VarList;
import p8lua.ast.expr.*;
import p8lua.ast.stmt.*;
import p8lua.lexer.Token;
import p8lua.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing a lossless tree: every significant token is kept
 * as a {@link Lexeme} with the trivia in front of it, and the root chunk keeps the
 * trivia after its last statement.
 */
public final class Parser {

    private static final Set<String> ASSIGN_OPS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "..=", "^=", "\\=", "&=", "|=",
            "^^=", "<<=", ">>=", ">>>=", "<<>=", ">><=");

    private static final Set<String> UNARY_SYMBOLS = Set.of("-", "#", "~", "@", "%", "$");

    private static final Token PRINT = Token.name("?");

    private final TokenBuffer tokens;

    public Parser(TokenBuffer tokens) {
        this.tokens = tokens;
    }

    public Parser(List<Token> tokens) {
        this(new TokenBuffer(tokens));
    }

    public static Chunk parse(List<Token> tokens) {
        return new Parser(tokens).parseChunk();
    }

    // ---------- entry ----------
    public Chunk parseChunk() {
        List<Stmt> statements = new ArrayList<>();
        while (!tokens.atEnd()) {
            Stmt s = parseStatement();
            if (s == null) throw error("Expected statement");
            statements.add(s);
            tokens.advance();
        }
        return new Chunk(statements, tokens.trailingTrivia());
    }

    // ---------- blocks ----------
    private Chunk parseBlock() {
        List<Stmt> statements = new ArrayList<>();
        Stmt s;
        while ((s = parseStatement()) != null) statements.add(s);
        return Chunk.of(statements);
    }

    /** Body of a one-line {@code if} or {@code while}: it ends with {@code line}. */
    private Chunk parseLineBlock(int line) {
        int outer = tokens.limitToLine(line);
        try {
            return parseBlock();
        } finally {
            tokens.restoreLineLimit(outer);
        }
    }

    // ---------- statements ----------

    /** The next statement, or null if none starts at the cursor. */
    private Stmt parseStatement() {
        if (tokens.atEnd()) return null;

        Lexeme kw;
        if ((kw = symbol(";")) != null) return new EmptyStmt(kw);
        if ((kw = tokens.accept(TokenKind.LABEL)) != null) return new LabelStmt(kw);
        if ((kw = keyword("break")) != null) return new BreakStmt(kw);
        if ((kw = keyword("goto")) != null) {
            return new GotoStmt(kw, expectName("Expected label name after 'goto'"));
        }
        if ((kw = keyword("do")) != null) {
            Chunk body = parseBlock();
            return new DoStmt(kw, body, expectEnd("do"));
        }
        if ((kw = keyword("while")) != null) return parseWhile(kw);
        if ((kw = keyword("repeat")) != null) return parseRepeat(kw);
        if ((kw = keyword("if")) != null) return parseIf(kw);
        if ((kw = keyword("for")) != null) return parseFor(kw);
        if ((kw = keyword("function")) != null) {
            FunctionName name = parseFunctionName();
            return new FunctionStmt(kw, name, parseFunctionBody());
        }
        if ((kw = keyword("local")) != null) return parseLocal(kw);
        if ((kw = keyword("return")) != null) return new ReturnStmt(kw, parseExpListOpt());
        if ((kw = tokens.accept(PRINT)) != null) {
            int outer = tokens.limitToLine(kw.token().line());
            try {
                return new PrintStmt(kw, requireExpList("Expected expression after '?'"));
            } finally {
                tokens.restoreLineLimit(outer);
            }
        }
        return parseAssignmentOrCall();
    }

    private Stmt parseWhile(Lexeme whileKw) {
        Expr cond = requireExp("Expected condition after 'while'");
        Lexeme doKw = keyword("do");
        if (doKw != null) {
            Chunk body = parseBlock();
            return new WhileStmt(whileKw, cond, doKw, body, expectEnd("while"));
        }
        if (cond instanceof ParenExpr p) {
            Chunk body = parseLineBlock(p.close().token().line());
            return new WhileStmt(whileKw, cond, null, body, null);
        }
        throw error("Expected 'do' after 'while' condition");
    }

    private Stmt parseRepeat(Lexeme repeatKw) {
        Chunk body = parseBlock();
        Lexeme untilKw = expect(keyword("until"), "Expected 'until' to close 'repeat'");
        return new RepeatStmt(repeatKw, body, untilKw, requireExp("Expected condition after 'until'"));
    }

    private Stmt parseIf(Lexeme ifKw) {
        Expr cond = requireExp("Expected condition after 'if'");
        Lexeme thenKw = keyword("then");
        List<IfStmt.Branch> branches = new ArrayList<>();

        if (thenKw == null) {
            if (!(cond instanceof ParenExpr p)) throw error("Expected 'then' after 'if' condition");
            int outer = tokens.limitToLine(p.close().token().line());
            try {
                branches.add(new IfStmt.Branch(ifKw, cond, null, parseBlock()));
                Lexeme elseKw = keyword("else");
                if (elseKw != null) branches.add(new IfStmt.Branch(elseKw, null, null, parseBlock()));
            } finally {
                tokens.restoreLineLimit(outer);
            }
            return new IfStmt(branches, null);
        }

        branches.add(new IfStmt.Branch(ifKw, cond, thenKw, parseBlock()));
        Lexeme kw;
        while ((kw = keyword("elseif")) != null) {
            Expr c = requireExp("Expected condition after 'elseif'");
            Lexeme t = expect(keyword("then"), "Expected 'then' after 'elseif' condition");
            branches.add(new IfStmt.Branch(kw, c, t, parseBlock()));
        }
        if ((kw = keyword("else")) != null) {
            branches.add(new IfStmt.Branch(kw, null, null, parseBlock()));
        }
        return new IfStmt(branches, expectEnd("if"));
    }

    private Stmt parseFor(Lexeme forKw) {
        Lexeme first = expectName("Expected name after 'for'");

        Lexeme eq = symbol("=");
        if (eq != null) {
            Expr start = requireExp("Expected start value in 'for'");
            Lexeme limitComma = expect(symbol(","), "Expected ',' after 'for' start value");
            Expr limit = requireExp("Expected limit in 'for'");
            Lexeme stepComma = symbol(",");
            Expr step = stepComma == null ? null : requireExp("Expected step in 'for'");
            Lexeme doKw = expect(keyword("do"), "Expected 'do' after 'for' header");
            Chunk body = parseBlock();
            return new ForNumStmt(forKw, first, eq, start, limitComma, limit, stepComma, step,
                    doKw, body, expectEnd("for"));
        }

        List<Lexeme> names = new ArrayList<>();
        List<Lexeme> commas = new ArrayList<>();
        names.add(first);
        Lexeme c;
        while ((c = symbol(",")) != null) {
            commas.add(c);
            names.add(expectName("Expected name after ','"));
        }
        Lexeme inKw = expect(keyword("in"), "Expected '=' or 'in' after 'for' names");
        ExpList exps = requireExpList("Expected expression after 'in'");
        Lexeme doKw = expect(keyword("do"), "Expected 'do' after 'for' header");
        Chunk body = parseBlock();
        return new ForInStmt(forKw, new NameList(names, commas), inKw, exps, doKw, body, expectEnd("for"));
    }

    private Stmt parseLocal(Lexeme localKw) {
        Lexeme functionKw = keyword("function");
        if (functionKw != null) {
            Lexeme name = expectName("Expected name after 'local function'");
            return new LocalFunctionStmt(localKw, functionKw, name, parseFunctionBody());
        }

        List<Lexeme> names = new ArrayList<>();
        List<Lexeme> commas = new ArrayList<>();
        names.add(expectName("Expected name after 'local'"));
        Lexeme c;
        while ((c = symbol(",")) != null) {
            commas.add(c);
            names.add(expectName("Expected name after ','"));
        }
        Lexeme eq = symbol("=");
        ExpList values = eq == null ? null : requireExpList("Expected expression after '='");
        return new LocalAssignStmt(localKw, new NameList(names, commas), eq, values);
    }

    /**
     * An assignment or a call statement. Both start with a suffixed expression. If that
     * expression is a call with no assignment after it the statement is complete;
     * otherwise the buffer rewinds and the statement is parsed again as a target list.
     */
    private Stmt parseAssignmentOrCall() {
        tokens.mark();
        try {
            Expr head = parseSuffixedExp();
            if (head == null) return null;
            if (head.isCall() && !atAssignment()) return new CallStmt(head);
            tokens.rewind();
            return parseAssignment();
        } finally {
            tokens.release();
        }
    }

    private AssignStmt parseAssignment() {
        List<Expr> vars = new ArrayList<>();
        List<Lexeme> commas = new ArrayList<>();
        vars.add(parseTarget());
        Lexeme c;
        while ((c = symbol(",")) != null) {
            commas.add(c);
            vars.add(parseTarget());
        }
        Lexeme op = acceptAssignOp();
        if (op == null) throw error("Expected '=' after assignment target");
        ExpList values = requireExpList("Expected expression after '" + op.text() + "'");
        return new AssignStmt(new VarList(vars, commas), op, values);
    }

    private Expr parseTarget() {
        Token at = tokens.peekSignificant();
        Expr e = parseSuffixedExp();
        if (e == null || !e.isAssignable()) throw new ParserException("Cannot assign to this expression", at);
        return e;
    }

    private boolean atAssignment() {
        Token t = tokens.peekSignificant();
        return t != null && t.is(TokenKind.SYMBOL) && (t.text().equals(",") || ASSIGN_OPS.contains(t.text()));
    }

    private Lexeme acceptAssignOp() {
        Token t = tokens.peekSignificant();
        if (t == null || !t.is(TokenKind.SYMBOL) || !ASSIGN_OPS.contains(t.text())) return null;
        return tokens.accept(t);
    }

    // ---------- functions ----------
    private FunctionName parseFunctionName() {
        List<Lexeme> path = new ArrayList<>();
        List<Lexeme> dots = new ArrayList<>();
        path.add(expectName("Expected function name"));
        Lexeme dot;
        while ((dot = symbol(".")) != null) {
            dots.add(dot);
            path.add(expectName("Expected name after '.'"));
        }
        Lexeme colon = symbol(":");
        Lexeme method = colon == null ? null : expectName("Expected method name after ':'");
        return new FunctionName(path, dots, colon, method);
    }

    private FunctionBody parseFunctionBody() {
        Lexeme open = expect(symbol("("), "Expected '(' to start parameter list");
        NameList params = null;
        Lexeme varargComma = null;
        Lexeme varargs = symbol("...");

        if (varargs == null) {
            Lexeme first = name();
            if (first != null) {
                List<Lexeme> names = new ArrayList<>();
                List<Lexeme> commas = new ArrayList<>();
                names.add(first);
                Lexeme c;
                while ((c = symbol(",")) != null) {
                    Lexeme dots = symbol("...");
                    if (dots != null) {
                        varargComma = c;
                        varargs = dots;
                        break;
                    }
                    commas.add(c);
                    names.add(expectName("Expected parameter name"));
                }
                params = new NameList(names, commas);
            }
        }

        Lexeme close = expect(symbol(")"), "Expected ')' to close parameter list");
        Chunk body = parseBlock();
        return new FunctionBody(open, params, varargComma, varargs, close, body, expectEnd("function"));
    }

    // ---------- expressions ----------
    private Expr parseExp() {
        return parseSubExp(0);
    }

    /**
     * Precedence climbing: parses operands joined by binary operators binding tighter
     * than {@code limit}.
     */
    private Expr parseSubExp(int limit) {
        Expr left;
        Lexeme unary = acceptUnaryOp();
        if (unary != null) {
            Expr operand = parseSubExp(UnaryExpr.PRECEDENCE);
            if (operand == null) throw error("Expected expression after '" + unary.text() + "'");
            left = new UnaryExpr(UnaryExpr.Operator.fromSymbol(unary.text()), unary, operand);
        } else {
            left = parseSimpleExp();
            if (left == null) return null;
        }

        while (true) {
            Token next = tokens.peekSignificant();
            BinaryExpr.Operator op = binaryOperator(next);
            if (op == null || op.precedence() <= limit) break;
            Lexeme opToken = tokens.accept(next);
            Expr right = parseSubExp(op.rightAssociative() ? op.precedence() - 1 : op.precedence());
            if (right == null) throw error("Expected expression after '" + opToken.text() + "'");
            left = new BinaryExpr(left, op, opToken, right);
        }
        return left;
    }

    private static BinaryExpr.Operator binaryOperator(Token t) {
        if (t == null) return null;
        if (t.is(TokenKind.SYMBOL) || (t.is(TokenKind.KEYWORD) && (t.text().equals("and") || t.text().equals("or")))) {
            return BinaryExpr.Operator.fromSymbol(t.text());
        }
        return null;
    }

    private Lexeme acceptUnaryOp() {
        Token t = tokens.peekSignificant();
        if (t == null) return null;
        boolean unary = (t.is(TokenKind.KEYWORD) && t.text().equals("not")) ||
                (t.is(TokenKind.SYMBOL) && UNARY_SYMBOLS.contains(t.text()));
        return unary ? tokens.accept(t) : null;
    }

    private Expr parseSimpleExp() {
        Token t = tokens.peekSignificant();
        if (t == null) return null;

        if (t.is(TokenKind.NUMBER) || t.is(TokenKind.STRING)) return new ValueExpr(tokens.accept(t.kind()));
        if (t.is(TokenKind.KEYWORD)) {
            String w = t.text();
            if (w.equals("nil") || w.equals("true") || w.equals("false")) {
                return new ValueExpr(tokens.accept(TokenKind.KEYWORD));
            }
            if (w.equals("function")) {
                Lexeme kw = tokens.accept(TokenKind.KEYWORD);
                return new FunctionExpr(kw, parseFunctionBody());
            }
            return null;
        }
        if (t.matches(Token.symbol("..."))) return new VarargExpr(tokens.accept(t));
        if (t.matches(Token.symbol("{"))) return parseTable();
        return parseSuffixedExp();
    }

    private Expr parsePrimaryExp() {
        Lexeme n = name();
        if (n != null) return new VarExpr(n);

        Lexeme open = symbol("(");
        if (open != null) {
            Expr inner = requireExp("Expected expression after '('");
            Lexeme close = expect(symbol(")"), "Expected ')' to close '('");
            return new ParenExpr(open, inner, close);
        }
        return null;
    }

    /** A primary expression followed by any field, index, call or method call suffixes. */
    private Expr parseSuffixedExp() {
        Expr e = parsePrimaryExp();
        if (e == null) return null;

        while (true) {
            Lexeme l;
            if ((l = symbol(".")) != null) {
                e = new FieldAccessExpr(e, l, expectName("Expected name after '.'"));
                continue;
            }
            if ((l = symbol("[")) != null) {
                Expr index = requireExp("Expected expression after '['");
                e = new IndexExpr(e, l, index, expect(symbol("]"), "Expected ']' to close '['"));
                continue;
            }
            if ((l = symbol(":")) != null) {
                Lexeme method = expectName("Expected method name after ':'");
                Args args = parseArgs();
                if (args == null) throw error("Expected arguments after method name");
                e = new MethodCallExpr(e, l, method, args);
                continue;
            }
            Args args = parseArgs();
            if (args == null) return e;
            e = new CallExpr(e, args);
        }
    }

    private Args parseArgs() {
        Lexeme open = symbol("(");
        if (open != null) {
            ExpList exps = parseExpListOpt();
            return new Args.Paren(open, exps, expect(symbol(")"), "Expected ')' to close argument list"));
        }
        Token t = tokens.peekSignificant();
        if (t != null && t.matches(Token.symbol("{"))) return new Args.Table(parseTable());
        Lexeme s = tokens.accept(TokenKind.STRING);
        return s == null ? null : new Args.Str(s);
    }

    private TableExpr parseTable() {
        Lexeme open = expect(symbol("{"), "Expected '{'");
        List<Field> fields = new ArrayList<>();
        List<Lexeme> separators = new ArrayList<>();
        while (true) {
            Field f = parseField();
            if (f == null) break;
            fields.add(f);
            Lexeme sep = symbol(",");
            if (sep == null) sep = symbol(";");
            if (sep == null) break;
            separators.add(sep);
        }
        Lexeme close = expect(symbol("}"), "Expected '}' to close table");
        return new TableExpr(open, fields, separators, close);
    }

    private Field parseField() {
        Lexeme open = symbol("[");
        if (open != null) {
            Expr key = requireExp("Expected key expression after '['");
            Lexeme close = expect(symbol("]"), "Expected ']' after table key");
            Lexeme eq = expect(symbol("="), "Expected '=' after table key");
            return new Field.Keyed(open, key, close, eq, requireExp("Expected value after '='"));
        }

        // name = value, or a positional value starting with a name
        tokens.mark();
        Lexeme n = name();
        Lexeme eq = n == null ? null : symbol("=");
        if (eq == null) tokens.rewind();
        tokens.release();
        if (eq != null) return new Field.Named(n, eq, requireExp("Expected value after '='"));

        Expr value = parseExp();
        return value == null ? null : new Field.Positional(value);
    }

    private ExpList parseExpListOpt() {
        Expr first = parseExp();
        if (first == null) return null;
        List<Expr> exps = new ArrayList<>();
        List<Lexeme> commas = new ArrayList<>();
        exps.add(first);
        Lexeme c;
        while ((c = symbol(",")) != null) {
            commas.add(c);
            exps.add(requireExp("Expected expression after ','"));
        }
        return new ExpList(exps, commas);
    }

    private ExpList requireExpList(String message) {
        ExpList list = parseExpListOpt();
        if (list == null) throw error(message);
        return list;
    }

    private Expr requireExp(String message) {
        Expr e = parseExp();
        if (e == null) throw error(message);
        return e;
    }

    // ---------- helpers ----------
    private Lexeme keyword(String word) {
        return tokens.accept(Token.keyword(word));
    }

    private Lexeme symbol(String sym) {
        return tokens.accept(Token.symbol(sym));
    }

    /** A name other than the {@code ?} print shorthand. */
    private Lexeme name() {
        Token t = tokens.peekSignificant();
        if (t == null || !t.is(TokenKind.NAME) || t.matches(PRINT)) return null;
        return tokens.accept(TokenKind.NAME);
    }

    private Lexeme expectName(String message) {
        return expect(name(), message);
    }

    private Lexeme expectEnd(String opener) {
        return expect(keyword("end"), "Expected 'end' to close '" + opener + "'");
    }

    private Lexeme expect(Lexeme l, String message) {
        if (l == null) throw error(message);
        return l;
    }

    private ParserException error(String message) {
        return new ParserException(message, tokens.peekPastLimit());
    }
}
