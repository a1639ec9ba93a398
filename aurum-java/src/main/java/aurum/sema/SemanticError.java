package aurum.sema;

public record SemanticError(String message, int line) {

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
