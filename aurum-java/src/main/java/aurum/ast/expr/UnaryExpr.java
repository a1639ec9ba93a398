package aurum.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr expr,
        int line,
        int column
) implements Expr {
    public enum Operator {
        NEG("-"), NOT("not");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
