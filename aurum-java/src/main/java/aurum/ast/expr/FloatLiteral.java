package aurum.ast.expr;

public record FloatLiteral(double value) implements Expr {}
