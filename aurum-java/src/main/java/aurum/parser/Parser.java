package aurum.parser;

import aurum.ast.Program;
import aurum.ast.decl.FunctionDecl;
import aurum.ast.expr.*;
import aurum.ast.stmt.AssignStmt;
import aurum.ast.stmt.Block;
import aurum.ast.stmt.BreakStmt;
import aurum.ast.stmt.ContinueStmt;
import aurum.ast.stmt.ExprStmt;
import aurum.ast.stmt.ForStmt;
import aurum.ast.stmt.IfStmt;
import aurum.ast.stmt.ReturnStmt;
import aurum.ast.stmt.Stmt;
import aurum.ast.stmt.VarDeclStmt;
import aurum.ast.stmt.WhileStmt;
import aurum.lexer.Lexer;
import aurum.lexer.Token;
import aurum.lexer.TokenType;
import aurum.types.Type;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<FunctionDecl> functions = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            functions.add(parseFunctionDecl());
        }
        consume(TokenType.EOF, "Expected EOF");

        Program program = new Program(List.copyOf(functions));
        if (program.function("main").isEmpty()) {
            throw new ParseException("Program requires a 'main' function", 1, 1);
        }
        return program;
    }

    // ---------- function ----------
    private FunctionDecl parseFunctionDecl() {
        Token func = consume(TokenType.FUNC, "Expected 'func'");

        Token name;
        if (check(TokenType.IDENTIFIER) || check(TokenType.MAIN)) name = advance();
        else throw error(peek(), "Expected function name");

        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FunctionDecl.Param> params = parseParamsOpt();
        consume(TokenType.RPAREN, "Expected ')' after parameters");

        consume(TokenType.ARROW, "Expected '->' after parameters");
        Type returnType = parseReturnType();

        Block body = parseBlock();
        return new FunctionDecl(name.lexeme(), params, returnType, body, func.line());
    }

    private List<FunctionDecl.Param> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<FunctionDecl.Param> ps = new ArrayList<>();
        do {
            Token typeTok = peek();
            Type t = parseValueType("Invalid parameter type");
            Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
            ps.add(new FunctionDecl.Param(n.lexeme(), t, typeTok.line()));
        } while (match(TokenType.COMMA));
        return List.copyOf(ps);
    }

    // ---------- block / statements ----------
    private Block parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            // statements are newline-delimited; a ';' terminator is accepted and dropped
            if (match(TokenType.SEMICOLON)) continue;
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new Block(List.copyOf(stmts));
    }

    private Stmt parseStmt() {
        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.RETURN)) return parseReturn();
        if (match(TokenType.BREAK)) return new BreakStmt(previous().line());
        if (match(TokenType.CONTINUE)) return new ContinueStmt(previous().line());

        return parseSimpleStmt();
    }

    // the statement forms allowed in a for header
    private Stmt parseSimpleStmt() {
        if (peek().type().isTypeKeyword()) return parseVarDecl();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) return parseAssign();

        int line = peek().line();
        return new ExprStmt(parseExpr(), line);
    }

    private VarDeclStmt parseVarDecl() {
        int line = peek().line();
        Type type = parseValueType("Expected variable type");
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");

        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        return new VarDeclStmt(name.lexeme(), type, init, line);
    }

    private AssignStmt parseAssign() {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.ASSIGN, "Expected '='");
        Expr value = parseExpr();
        return new AssignStmt(name.lexeme(), value, name.line());
    }

    private IfStmt parseIf() {
        int line = previous().line();
        List<IfStmt.Branch> branches = new ArrayList<>();
        branches.add(parseBranch("if"));

        while (match(TokenType.ELIF)) {
            branches.add(parseBranch("elif"));
        }

        Block elseB = null;
        if (match(TokenType.ELSE)) {
            elseB = parseBlock();
        }
        return new IfStmt(List.copyOf(branches), elseB, line);
    }

    private IfStmt.Branch parseBranch(String keyword) {
        consume(TokenType.LPAREN, "Expected '(' after " + keyword);
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')' after " + keyword + " condition");
        return new IfStmt.Branch(cond, parseBlock());
    }

    private WhileStmt parseWhile() {
        int line = previous().line();
        consume(TokenType.LPAREN, "Expected '(' after while");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')' after while condition");
        Block body = parseBlock();
        return new WhileStmt(cond, body, line);
    }

    private ForStmt parseFor() {
        int line = previous().line();
        consume(TokenType.LPAREN, "Expected '(' after for");

        Stmt init = check(TokenType.SEMICOLON) ? null : parseSimpleStmt();
        consume(TokenType.SEMICOLON, "Expected ';' after for initializer");

        Expr cond = check(TokenType.SEMICOLON) ? null : parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after for condition");

        Stmt update = check(TokenType.RPAREN) ? null : parseSimpleStmt();
        consume(TokenType.RPAREN, "Expected ')' after for");

        Block body = parseBlock();
        return new ForStmt(init, cond, update, body, line);
    }

    private ReturnStmt parseReturn() {
        int line = previous().line();
        if (check(TokenType.RBRACE) || check(TokenType.SEMICOLON) || check(TokenType.EOF)) {
            return new ReturnStmt(null, line);
        }
        return new ReturnStmt(parseExpr(), line);
    }

    // ---------- types ----------
    private Type parseValueType(String msg) {
        if (match(TokenType.INT)) return Type.INT;
        if (match(TokenType.FLOAT)) return Type.FLOAT;
        if (match(TokenType.STRING)) return Type.STRING;
        if (match(TokenType.BOOL)) return Type.BOOL;
        throw error(peek(), msg);
    }

    private Type parseReturnType() {
        if (match(TokenType.VOID)) return Type.VOID;
        return parseValueType("Invalid return type");
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseOr(); }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseEquality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseEquality();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseEquality() {
        Expr e = parseCompare();
        while (match(TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
            Token op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r, op.line(), op.column());
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary(), op.line(), op.column());
        }
        if (match(TokenType.MINUS)) {
            Token op = previous();
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary(), op.line(), op.column());
        }
        return parseCall();
    }

    private Expr parseCall() {
        Expr e = parsePrimary();
        if (match(TokenType.LPAREN)) {
            if (!(e instanceof VarExpr v)) {
                throw error(previous(), "Only functions can be called");
            }
            List<Expr> args = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do { args.add(parseExpr()); } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "Expected ')' after arguments");
            return new CallExpr(v.name(), List.copyOf(args), v.line(), v.column());
        }
        return e;
    }

    private Expr parsePrimary() {
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("true".equals(previous().lexeme()));
        if (match(TokenType.INT_LITERAL)) return intLiteral(previous());
        if (match(TokenType.FLOAT_LITERAL)) return new FloatLiteral(Double.parseDouble(previous().lexeme()));
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(unquote(previous().lexeme()));
        if (match(TokenType.IDENTIFIER)) {
            Token t = previous();
            return new VarExpr(t.lexeme(), t.line(), t.column());
        }
        if (match(TokenType.READ)) {
            Token t = previous();
            consume(TokenType.LPAREN, "Expected '(' after 'read'");
            consume(TokenType.RPAREN, "Expected ')' after 'read('");
            return new CallExpr("read", List.of(), t.line(), t.column());
        }
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression");
    }

    private IntLiteral intLiteral(Token t) {
        try {
            return new IntLiteral(Long.parseLong(t.lexeme()));
        } catch (NumberFormatException e) {
            throw error(t, "Integer literal out of range");
        }
    }

    private static String unquote(String lexeme) {
        String body = lexeme.substring(1, lexeme.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char n = body.charAt(++i);
            switch (n) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '"', '\'', '\\' -> sb.append(n);
                default -> sb.append('\\').append(n);
            }
        }
        return sb.toString();
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParseException error(Token at, String msg) {
        return new ParseException(msg + " (got " + at.type() + " '" + at.lexeme() + "')", at.line(), at.column());
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
