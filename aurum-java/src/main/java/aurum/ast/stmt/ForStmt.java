package aurum.ast.stmt;

import aurum.ast.expr.Expr;

// any of the three parts may be null
public record ForStmt(
        Stmt init,
        Expr condition,
        Stmt update,
        Block body,
        int line
) implements Stmt {}
