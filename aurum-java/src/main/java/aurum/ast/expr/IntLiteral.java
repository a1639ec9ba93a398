package aurum.ast.expr;

public record IntLiteral(long value) implements Expr {}
