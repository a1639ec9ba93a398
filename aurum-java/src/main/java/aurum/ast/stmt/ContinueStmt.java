package aurum.ast.stmt;

public record ContinueStmt(int line) implements Stmt {}
