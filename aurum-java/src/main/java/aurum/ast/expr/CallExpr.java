package aurum.ast.expr;

import java.util.List;

public record CallExpr(
        String name,
        List<Expr> args,
        int line,
        int column
) implements Expr {}
