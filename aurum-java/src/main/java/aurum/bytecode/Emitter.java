package aurum.bytecode;

import java.util.ArrayList;
import java.util.List;

// Jumps name their target; the VM resolves names to indices at load time.
public final class Emitter {
    private final List<Insn> code = new ArrayList<>();
    private int nextLabel = 0;

    public int pc() { return code.size(); }

    public List<Insn> code() { return code; }

    // the leading dot keeps generated labels apart from function names
    public String newLabel() { return ".L" + nextLabel++; }

    public void bind(String label) {
        emit(Opcode.LABEL, label);
    }

    public void emit(Opcode op, Object... operands) {
        code.add(Insn.of(op, operands));
    }

    public void jump(String label) {
        emit(Opcode.JUMP, label);
    }

    public void jumpIfFalse(String label) {
        emit(Opcode.JUMP_IF_FALSE, label);
    }
}
