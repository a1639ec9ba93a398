package aurum.ast.stmt;

import aurum.ast.expr.Expr;

public record AssignStmt(
        String name,
        Expr value,
        int line
) implements Stmt {}
