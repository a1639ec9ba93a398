package aurum.ast.stmt;

public record BreakStmt(int line) implements Stmt {}
