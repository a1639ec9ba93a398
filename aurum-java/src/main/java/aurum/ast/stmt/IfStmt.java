package aurum.ast.stmt;

import aurum.ast.expr.Expr;

import java.util.List;

public record IfStmt(
        List<Branch> branches,   // if + elif ...
        Block elseBlock,         // may be null
        int line
) implements Stmt {
    public record Branch(Expr condition, Block body) {}
}
