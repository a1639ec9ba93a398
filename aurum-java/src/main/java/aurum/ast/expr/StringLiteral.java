package aurum.ast.expr;

public record StringLiteral(String value) implements Expr {}
