package aurum.ast.expr;

public record BoolLiteral(boolean value) implements Expr {}
