package aurum.bytecode;

import aurum.ast.decl.FunctionDecl;
import aurum.ast.expr.*;
import aurum.ast.stmt.*;
import aurum.types.Type;

import java.util.Map;

import static aurum.bytecode.Opcode.*;

// LABEL name; ENTER n; STORE_PARAM i addr...; body; [RETURN]; LEAVE
final class SingleFunctionCompiler {

    private record Loop(String breakLabel, String continueLabel) {}

    private final Emitter out;
    private final Map<String, Integer> addresses;

    SingleFunctionCompiler(Emitter out, Map<String, Integer> addresses) {
        this.out = out;
        this.addresses = addresses;
    }

    void compile(FunctionDecl fn) {
        out.bind(fn.name());
        out.emit(ENTER, fn.params().size());
        for (int i = 0; i < fn.params().size(); i++) {
            out.emit(STORE_PARAM, i, addressOf(fn.params().get(i).name()));
        }

        emitBlock(fn.body(), null);

        if (fn.returnType() == Type.VOID) out.emit(RETURN);
        out.emit(LEAVE);
    }

    private int addressOf(String name) {
        return addresses.computeIfAbsent(name, k -> addresses.size());
    }

    // ---------- statements ----------
    private void emitBlock(Block b, Loop loop) {
        for (Stmt s : b.statements()) emitStmt(s, loop);
    }

    private void emitStmt(Stmt s, Loop loop) {
        if (s instanceof VarDeclStmt v) {
            if (v.initializer() != null) {
                emitExpr(v.initializer());
            } else {
                out.emit(LOAD_CONST, Value.defaultFor(v.type()));
            }
            out.emit(STORE, addressOf(v.name()));

        } else if (s instanceof AssignStmt a) {
            emitExpr(a.value());
            out.emit(STORE, addressOf(a.name()));

        } else if (s instanceof IfStmt i) {
            String end = out.newLabel();
            for (IfStmt.Branch br : i.branches()) {
                String next = out.newLabel();
                emitExpr(br.condition());
                out.jumpIfFalse(next);
                emitBlock(br.body(), loop);
                out.jump(end);
                out.bind(next);
            }
            if (i.elseBlock() != null) emitBlock(i.elseBlock(), loop);
            out.bind(end);

        } else if (s instanceof WhileStmt w) {
            String start = out.newLabel();
            String end = out.newLabel();
            out.bind(start);
            emitExpr(w.condition());
            out.jumpIfFalse(end);
            emitBlock(w.body(), new Loop(end, start));
            out.jump(start);
            out.bind(end);

        } else if (s instanceof ForStmt f) {
            if (f.init() != null) emitStmt(f.init(), loop);
            String start = out.newLabel();
            String update = out.newLabel();
            String end = out.newLabel();
            out.bind(start);
            if (f.condition() != null) {
                emitExpr(f.condition());
                out.jumpIfFalse(end);
            }
            // continue runs the update before the condition is tested again
            emitBlock(f.body(), new Loop(end, update));
            out.bind(update);
            if (f.update() != null) emitStmt(f.update(), loop);
            out.jump(start);
            out.bind(end);

        } else if (s instanceof ReturnStmt r) {
            if (r.value() == null) {
                out.emit(RETURN);
            } else {
                emitExpr(r.value());
                out.emit(RETURN_VALUE);
            }

        } else if (s instanceof BreakStmt b) {
            if (loop == null) throw new CodeGenException("'break' outside of a loop", b.line());
            out.jump(loop.breakLabel());

        } else if (s instanceof ContinueStmt c) {
            if (loop == null) throw new CodeGenException("'continue' outside of a loop", c.line());
            out.jump(loop.continueLabel());

        } else if (s instanceof ExprStmt e) {
            emitExpr(e.expr());
            out.emit(POP);

        } else {
            throw new CodeGenException("Unsupported statement: " + s.getClass().getSimpleName(), s.line());
        }
    }

    // ---------- expressions ----------
    private void emitExpr(Expr e) {
        if (e instanceof IntLiteral i) {
            out.emit(LOAD_CONST, new Value.Int(i.value()));
        } else if (e instanceof FloatLiteral f) {
            out.emit(LOAD_CONST, new Value.Float(f.value()));
        } else if (e instanceof StringLiteral s) {
            out.emit(LOAD_CONST, new Value.Str(s.value()));
        } else if (e instanceof BoolLiteral b) {
            out.emit(LOAD_CONST, new Value.Bool(b.value()));
        } else if (e instanceof VarExpr v) {
            out.emit(LOAD, addressOf(v.name()));
        } else if (e instanceof BinaryExpr b) {
            emitExpr(b.left());
            emitExpr(b.right());
            out.emit(binaryOpcode(b.op()));
        } else if (e instanceof UnaryExpr u) {
            emitExpr(u.expr());
            out.emit(u.op() == UnaryExpr.Operator.NEG ? NEG : NOT);
        } else if (e instanceof CallExpr c) {
            for (Expr arg : c.args()) emitExpr(arg);
            out.emit(CALL, c.name(), c.args().size());
        } else {
            throw new IllegalStateException("Unsupported expression: " + e.getClass().getSimpleName());
        }
    }

    private static Opcode binaryOpcode(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD -> Opcode.ADD;
            case SUB -> Opcode.SUB;
            case MUL -> Opcode.MUL;
            case DIV -> Opcode.DIV;
            case MOD -> Opcode.MOD;
            case EQ -> Opcode.EQ;
            case NE -> Opcode.NEQ;
            case LT -> Opcode.LT;
            case GT -> Opcode.GT;
            case LE -> Opcode.LEQ;
            case GE -> Opcode.GEQ;
            case AND -> Opcode.AND;
            case OR -> Opcode.OR;
        };
    }
}
