package aurum.ast.stmt;

import aurum.ast.expr.Expr;

public record ExprStmt(Expr expr, int line) implements Stmt {}
