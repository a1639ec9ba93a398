package aurum.bytecode;

public class CodeGenException extends RuntimeException {
    private final int line;

    public CodeGenException(String message, int line) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int line() { return line; }
}
