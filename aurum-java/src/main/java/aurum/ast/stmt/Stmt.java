package aurum.ast.stmt;

public sealed interface Stmt
        permits VarDeclStmt, AssignStmt, IfStmt, WhileStmt, ForStmt,
        ReturnStmt, BreakStmt, ContinueStmt, ExprStmt {

    int line();
}
