package aurum.bytecode;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.stream.Collectors;

// Operands are Integer, String or Value, checked against the opcode signature.
public record Insn(Opcode op, List<Object> operands) {

    public Insn {
        Preconditions.checkNotNull(op, "op");
        operands = List.copyOf(operands);
        String sig = op.signature();
        Preconditions.checkArgument(operands.size() == sig.length(),
                "%s takes %s operand(s), got %s", op, sig.length(), operands.size());
        for (int i = 0; i < sig.length(); i++) {
            Object o = operands.get(i);
            Class<?> expected = switch (sig.charAt(i)) {
                case 'I' -> Integer.class;
                case 'S' -> String.class;
                default -> Value.class;
            };
            Preconditions.checkArgument(expected.isInstance(o),
                    "%s operand %s must be %s, got %s", op, i, expected.getSimpleName(), o);
        }
    }

    public static Insn of(Opcode op, Object... operands) {
        return new Insn(op, List.of(operands));
    }

    public int intArg(int i) { return (Integer) operands.get(i); }

    public String stringArg(int i) { return (String) operands.get(i); }

    public Value valueArg(int i) { return (Value) operands.get(i); }

    @Override
    public String toString() {
        if (operands.isEmpty()) return op.name();
        return op.name() + " " + operands.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
