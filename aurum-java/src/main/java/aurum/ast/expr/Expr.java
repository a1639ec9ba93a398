package aurum.ast.expr;

public sealed interface Expr
        permits IntLiteral, FloatLiteral, StringLiteral, BoolLiteral,
        VarExpr, BinaryExpr, UnaryExpr, CallExpr {}
