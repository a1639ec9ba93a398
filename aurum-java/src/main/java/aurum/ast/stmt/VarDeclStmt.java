package aurum.ast.stmt;

import aurum.ast.expr.Expr;
import aurum.types.Type;

public record VarDeclStmt(
        String name,
        Type type,
        Expr initializer,   // may be null
        int line
) implements Stmt {}
