package aurum.ast.stmt;

import aurum.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        Block body,
        int line
) implements Stmt {}
