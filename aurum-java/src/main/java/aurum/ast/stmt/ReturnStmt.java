package aurum.ast.stmt;

import aurum.ast.expr.Expr;

public record ReturnStmt(Expr value, int line) implements Stmt {}
