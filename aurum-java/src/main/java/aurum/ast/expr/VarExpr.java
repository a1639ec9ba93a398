package aurum.ast.expr;

public record VarExpr(String name, int line, int column) implements Expr {}
