package aurum.sema;

import aurum.ast.Program;
import aurum.ast.decl.FunctionDecl;
import aurum.ast.expr.*;
import aurum.ast.stmt.*;
import aurum.types.Type;
import aurum.types.TypeUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Scope and type analysis.
 *
 * <p>Function signatures are declared into the global scope before any body is visited, which is
 * what makes forward references and mutual recursion legal. Problems are collected as
 * {@link SemanticError} values and analysis keeps going; an empty result means the program can be
 * handed to the code generator.
 */
public final class TypeChecker {

    // derived for each nested visit, never mutated
    private record Context(int scope, FunctionDecl function, boolean inLoop) {
        Context withScope(int s) { return new Context(s, function, inLoop); }
        Context enterLoop() { return new Context(scope, function, true); }
    }

    private SymbolTable table;
    private List<SemanticError> errors;

    public List<SemanticError> check(Program program) {
        table = new SymbolTable();
        errors = new ArrayList<>();

        declareBuiltins();

        // 1) predeclare functions
        for (FunctionDecl f : program.functions()) {
            List<Type> ps = new ArrayList<>();
            for (FunctionDecl.Param p : f.params()) ps.add(p.type());
            FuncSymbol fs = new FuncSymbol(f.name(), List.copyOf(ps), f.returnType(), f.line());
            if (!table.define(SymbolTable.GLOBAL, fs)) {
                error(f.line(), "Function '" + f.name() + "' is already declared");
            }
        }

        checkMain();

        // 2) function bodies
        for (FunctionDecl f : program.functions()) {
            checkFunction(f);
        }

        return List.copyOf(errors);
    }

    private void declareBuiltins() {
        table.define(SymbolTable.GLOBAL, new FuncSymbol("read", List.of(), Type.STRING, 0));
        table.define(SymbolTable.GLOBAL, new FuncSymbol("print", List.of(Type.ANY), Type.VOID, 0));
        table.define(SymbolTable.GLOBAL, new FuncSymbol("write", List.of(Type.ANY), Type.VOID, 0));
    }

    private void checkMain() {
        Symbol main = table.lookupLocal(SymbolTable.GLOBAL, "main");
        if (!(main instanceof FuncSymbol fs)) {
            error(1, "Program requires a 'main' function");
        } else if (fs.returnType() != Type.VOID) {
            error(fs.line(), "Function 'main' must return void, not " + fs.returnType());
        } else if (!fs.paramTypes().isEmpty()) {
            error(fs.line(), "Function 'main' cannot take parameters");
        }
    }

    private void checkFunction(FunctionDecl f) {
        int scope = table.newScope(SymbolTable.GLOBAL);

        for (FunctionDecl.Param p : f.params()) {
            if (!table.define(scope, new VarSymbol(p.name(), p.type(), p.line()))) {
                error(p.line(), "Parameter '" + p.name() + "' is already declared in '" + f.name() + "'");
            }
        }

        Context ctx = new Context(scope, f, false);
        for (Stmt s : f.body().statements()) checkStmt(s, ctx);

        if (f.returnType() != Type.VOID && !hasReturn(f.body().statements())) {
            error(f.line(), "Function '" + f.name() + "' must return a value of type " + f.returnType()
                    + " on every path");
        }
    }

    // a direct return, or an if chain with an else where every branch returns
    static boolean hasReturn(List<Stmt> stmts) {
        for (Stmt s : stmts) {
            if (s instanceof ReturnStmt) return true;
            if (s instanceof IfStmt i && i.elseBlock() != null) {
                boolean all = hasReturn(i.elseBlock().statements());
                for (IfStmt.Branch br : i.branches()) {
                    all &= hasReturn(br.body().statements());
                }
                if (all) return true;
            }
        }
        return false;
    }

    private void checkBlock(Block b, Context ctx) {
        Context inner = ctx.withScope(table.newScope(ctx.scope()));
        for (Stmt s : b.statements()) checkStmt(s, inner);
    }

    private void checkStmt(Stmt s, Context ctx) {
        if (s instanceof VarDeclStmt v) {
            if (v.initializer() != null) {
                Type initT = typeOf(v.initializer(), ctx);
                if (initT != null && !TypeUtil.isAssignable(v.type(), initT)) {
                    error(v.line(), "Cannot assign " + initT + " to variable '" + v.name() + "' of type " + v.type());
                }
            }
            if (!table.define(ctx.scope(), new VarSymbol(v.name(), v.type(), v.line()))) {
                error(v.line(), "Variable '" + v.name() + "' is already declared in this scope");
            }

        } else if (s instanceof AssignStmt a) {
            Symbol sym = table.lookup(ctx.scope(), a.name());
            if (sym == null) {
                error(a.line(), "Variable '" + a.name() + "' is not declared");
                return;
            }
            if (!(sym instanceof VarSymbol vs)) {
                error(a.line(), "Cannot assign to function '" + a.name() + "'");
                return;
            }
            Type rt = typeOf(a.value(), ctx);
            if (rt != null && !TypeUtil.isAssignable(vs.type(), rt)) {
                error(a.line(), "Cannot assign " + rt + " to variable '" + a.name() + "' of type " + vs.type());
            }

        } else if (s instanceof IfStmt i) {
            boolean first = true;
            for (IfStmt.Branch br : i.branches()) {
                requireBool(typeOf(br.condition(), ctx), first ? "if" : "elif", i.line());
                checkBlock(br.body(), ctx);
                first = false;
            }
            if (i.elseBlock() != null) checkBlock(i.elseBlock(), ctx);

        } else if (s instanceof WhileStmt w) {
            requireBool(typeOf(w.condition(), ctx), "while", w.line());
            checkBlock(w.body(), ctx.enterLoop());

        } else if (s instanceof ForStmt f) {
            Context forCtx = ctx.withScope(table.newScope(ctx.scope()));
            if (f.init() != null) checkStmt(f.init(), forCtx);
            if (f.condition() != null) requireBool(typeOf(f.condition(), forCtx), "for", f.line());
            if (f.update() != null) checkStmt(f.update(), forCtx);
            checkBlock(f.body(), forCtx.enterLoop());

        } else if (s instanceof ReturnStmt r) {
            checkReturn(r, ctx);

        } else if (s instanceof BreakStmt b) {
            if (!ctx.inLoop()) error(b.line(), "'break' outside of a loop");

        } else if (s instanceof ContinueStmt c) {
            if (!ctx.inLoop()) error(c.line(), "'continue' outside of a loop");

        } else if (s instanceof ExprStmt e) {
            typeOf(e.expr(), ctx);
        }
    }

    private void checkReturn(ReturnStmt r, Context ctx) {
        FunctionDecl fn = ctx.function();
        Type expected = fn.returnType();

        if (r.value() == null) {
            if (expected != Type.VOID) {
                error(r.line(), "Function '" + fn.name() + "' must return a value of type " + expected);
            }
            return;
        }

        Type t = typeOf(r.value(), ctx);
        if (expected == Type.VOID) {
            error(r.line(), "Function '" + fn.name() + "' is void and cannot return a value");
        } else if (t != null && !TypeUtil.isAssignable(expected, t)) {
            error(r.line(), "Return type mismatch in '" + fn.name() + "': expected " + expected + ", got " + t);
        }
    }

    private void requireBool(Type t, String what, int line) {
        if (t != null && t != Type.BOOL) error(line, what + " condition must be bool, got " + t);
    }

    // null when a sub-expression already failed and was reported
    private Type typeOf(Expr e, Context ctx) {
        if (e instanceof IntLiteral) return Type.INT;
        if (e instanceof FloatLiteral) return Type.FLOAT;
        if (e instanceof StringLiteral) return Type.STRING;
        if (e instanceof BoolLiteral) return Type.BOOL;

        if (e instanceof VarExpr v) {
            Symbol sym = table.lookup(ctx.scope(), v.name());
            if (sym == null) {
                error(v.line(), "Unknown variable '" + v.name() + "'");
                return null;
            }
            if (sym instanceof VarSymbol vs) return vs.type();
            error(v.line(), "'" + v.name() + "' is a function, not a variable");
            return null;
        }

        if (e instanceof BinaryExpr b) return typeBinary(b, ctx);
        if (e instanceof UnaryExpr u) return typeUnary(u, ctx);
        if (e instanceof CallExpr c) return typeCall(c, ctx);

        throw new IllegalStateException("Unhandled expression: " + e.getClass().getSimpleName());
    }

    private Type typeBinary(BinaryExpr b, Context ctx) {
        Type l = typeOf(b.left(), ctx);
        Type r = typeOf(b.right(), ctx);
        if (l == null || r == null) return null;

        BinaryExpr.Operator op = b.op();
        if (op.isArithmetic()) {
            if (op == BinaryExpr.Operator.ADD && (l == Type.STRING || r == Type.STRING)
                    && l != Type.VOID && r != Type.VOID) {
                return Type.STRING;
            }
            Type res = TypeUtil.numericResult(l, r);
            if (res != null) return res;
            error(b.line(), "Operator '" + op.symbol() + "' cannot be applied to " + l + " and " + r);
            return null;
        }

        if (op.isComparison()) {
            if (TypeUtil.isComparable(l, r)) return Type.BOOL;
            error(b.line(), "Cannot compare " + l + " and " + r + " with '" + op.symbol() + "'");
            return null;
        }

        // and / or
        if (l == Type.BOOL && r == Type.BOOL) return Type.BOOL;
        error(b.line(), "Operator '" + op.symbol() + "' expects bool operands, got " + l + " and " + r);
        return null;
    }

    private Type typeUnary(UnaryExpr u, Context ctx) {
        Type a = typeOf(u.expr(), ctx);
        if (a == null) return null;

        return switch (u.op()) {
            case NOT -> {
                if (a == Type.BOOL) yield Type.BOOL;
                error(u.line(), "Operator '" + u.op().symbol() + "' expects bool, got " + a);
                yield null;
            }
            case NEG -> {
                if (a.isNumeric()) yield a;
                error(u.line(), "Unary '" + u.op().symbol() + "' expects a number, got " + a);
                yield null;
            }
        };
    }

    private Type typeCall(CallExpr c, Context ctx) {
        Symbol sym = table.lookup(ctx.scope(), c.name());
        if (sym == null) {
            error(c.line(), "Unknown function '" + c.name() + "'");
            return null;
        }
        if (!(sym instanceof FuncSymbol fs)) {
            error(c.line(), "'" + c.name() + "' is not a function");
            return null;
        }

        if (fs.paramTypes().size() != c.args().size()) {
            error(c.line(), "Function '" + c.name() + "' expects " + fs.paramTypes().size()
                    + " argument(s), got " + c.args().size());
            return fs.returnType();
        }

        for (int i = 0; i < c.args().size(); i++) {
            Type argT = typeOf(c.args().get(i), ctx);
            Type paramT = fs.paramTypes().get(i);
            if (argT != null && !TypeUtil.isAssignable(paramT, argT)) {
                String expected = paramT == Type.ANY ? "a value" : paramT.toString();
                error(c.line(), "Argument " + (i + 1) + " of '" + c.name() + "': expected " + expected + ", got " + argT);
            }
        }
        return fs.returnType();
    }

    private void error(int line, String message) {
        errors.add(new SemanticError(message, line));
    }
}
