package aurum.ast.stmt;

import java.util.List;

public record Block(List<Stmt> statements) {}
