package aurum.vm;

import java.util.List;

public class VmException extends RuntimeException {
    private final int instructionIndex;
    private final List<String> output;

    public VmException(String message, int instructionIndex, List<String> output) {
        super("[ip " + instructionIndex + "] " + message);
        this.instructionIndex = instructionIndex;
        this.output = List.copyOf(output);
    }

    public int instructionIndex() { return instructionIndex; }

    public List<String> output() { return output; }
}
