package aurum.vm;

import aurum.bytecode.CompiledProgram;
import aurum.bytecode.Insn;
import aurum.bytecode.Opcode;
import aurum.bytecode.Value;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Stack machine for {@link CompiledProgram}s.
 *
 * <p>Memory is a flat array of {@link Value} slots shared by all functions. A call pushes a
 * {@link Frame} holding the arguments; the callee copies them into memory with
 * {@code STORE_PARAM}. The builtins {@code print}, {@code write} and {@code read} run inline and
 * never push a frame.
 *
 * <p>An instance is not thread-safe. Run concurrent programs on separate instances.
 */
public final class VirtualMachine {
    private static final Logger log = LoggerFactory.getLogger(VirtualMachine.class);

    public static final int DEFAULT_MEMORY_SIZE = 1000;

    private final int memorySize;

    private List<Insn> code = List.of();
    private final Map<String, Integer> labels = new HashMap<>();

    private Value[] memory;
    private final Deque<Value> stack = new ArrayDeque<>();
    private final Deque<Frame> callStack = new ArrayDeque<>();
    private final Deque<String> input = new ArrayDeque<>();
    private final List<String> output = new ArrayList<>();

    private int ip;
    private boolean running;
    private long steps;

    public VirtualMachine() {
        this(DEFAULT_MEMORY_SIZE);
    }

    public VirtualMachine(int memorySize) {
        Preconditions.checkArgument(memorySize > 0, "memory size must be positive: %s", memorySize);
        this.memorySize = memorySize;
        this.memory = new Value[memorySize];
    }

    // resets all execution state, including pending input
    public void loadProgram(CompiledProgram program) {
        Preconditions.checkNotNull(program, "program");
        code = List.of();
        labels.clear();
        memory = new Value[memorySize];
        stack.clear();
        callStack.clear();
        input.clear();
        output.clear();
        ip = 0;
        steps = 0;
        running = false;

        List<Insn> insns = program.instructions();
        for (int i = 0; i < insns.size(); i++) {
            Insn insn = insns.get(i);
            if (insn.op() == Opcode.LABEL) {
                Integer prev = labels.putIfAbsent(insn.stringArg(0), i);
                if (prev != null) {
                    labels.clear();
                    throw new VmException("Duplicate label '" + insn.stringArg(0) + "' (first at " + prev + ")",
                            i, List.of());
                }
            }
        }
        code = insns;
        running = true;

        log.debug("Loaded {} instructions, {} labels", code.size(), labels.size());
    }

    public void setInput(List<String> lines) {
        input.clear();
        input.addAll(lines);
    }

    // runs until HALT, a return from the outermost frame, or the end of the code
    public List<String> execute() {
        while (running && ip < code.size()) {
            step(code.get(ip));
            steps++;
        }
        running = false;
        log.debug("Halted at ip {} after {} steps", ip, steps);
        return ImmutableList.copyOf(output);
    }

    public VmState state() {
        ImmutableSortedMap.Builder<Integer, Value> written = ImmutableSortedMap.naturalOrder();
        for (int addr = 0; addr < memory.length; addr++) {
            if (memory[addr] != null) written.put(addr, memory[addr]);
        }
        // both deques keep their top at the head
        ImmutableList<Value> values = ImmutableList.copyOf(stack).reverse();
        ImmutableList<String> frames = callStack.stream()
                .map(Frame::toString)
                .collect(ImmutableList.toImmutableList())
                .reverse();
        return new VmState(written.build(), values, frames, ip, !running);
    }

    private void step(Insn insn) {
        switch (insn.op()) {
            case LOAD_CONST -> push(insn.valueArg(0));
            case LOAD -> {
                int addr = checkAddress(insn.intArg(0));
                Value v = memory[addr];
                if (v == null) throw fail("Read of uninitialized memory at address " + addr);
                push(v);
            }
            case STORE -> memory[checkAddress(insn.intArg(0))] = pop();
            case STORE_PARAM -> {
                Frame frame = callStack.peek();
                if (frame == null) throw fail("STORE_PARAM outside of a function call");
                int index = insn.intArg(0);
                if (index < 0 || index >= frame.args().size()) {
                    throw fail("Parameter index " + index + " out of range for " + frame.args().size() + " argument(s)");
                }
                memory[checkAddress(insn.intArg(1))] = frame.args().get(index);
            }

            case ADD, SUB, MUL, DIV, MOD -> {
                Value r = pop();
                Value l = pop();
                push(arithmetic(insn.op(), l, r));
            }
            case EQ, NEQ -> {
                Value r = pop();
                Value l = pop();
                boolean eq = valueEquals(l, r);
                push(new Value.Bool(insn.op() == Opcode.EQ ? eq : !eq));
            }
            case LT, GT, LEQ, GEQ -> {
                Value r = pop();
                Value l = pop();
                push(new Value.Bool(compare(insn.op(), l, r)));
            }
            case AND -> {
                Value r = pop();
                Value l = pop();
                push(new Value.Bool(l.truthy() && r.truthy()));
            }
            case OR -> {
                Value r = pop();
                Value l = pop();
                push(new Value.Bool(l.truthy() || r.truthy()));
            }
            case NOT -> push(new Value.Bool(!pop().truthy()));
            case NEG -> {
                Value v = pop();
                if (v instanceof Value.Int i) push(new Value.Int(-i.v()));
                else if (v instanceof Value.Float f) push(new Value.Float(-f.v()));
                else throw fail("Cannot negate " + v.typeName());
            }

            case JUMP -> {
                ip = resolve(insn.stringArg(0));
                return;
            }
            case JUMP_IF_FALSE -> {
                if (!pop().truthy()) {
                    ip = resolve(insn.stringArg(0));
                    return;
                }
            }
            case CALL -> {
                if (call(insn.stringArg(0), insn.intArg(1))) return;
            }
            case RETURN -> {
                if (callStack.isEmpty()) {
                    running = false;
                    return;
                }
                Frame frame = callStack.pop();
                push(Value.NULL);
                ip = frame.returnAddress();
                return;
            }
            case RETURN_VALUE -> {
                Value v = pop();
                if (callStack.isEmpty()) {
                    running = false;
                    return;
                }
                Frame frame = callStack.pop();
                push(v);
                ip = frame.returnAddress();
                return;
            }
            case POP -> pop();
            case HALT -> {
                running = false;
                return;
            }
            case LABEL, ENTER, LEAVE -> {
                // markers only
            }
        }
        ip++;
    }

    // true when control was transferred
    private boolean call(String name, int argc) {
        switch (name) {
            case "print", "write" -> {
                if (argc != 1) throw fail(name + "() expects 1 argument, got " + argc);
                output.add(pop().text());
                push(Value.NULL);
                return false;
            }
            case "read" -> {
                if (argc != 0) throw fail("read() expects no arguments, got " + argc);
                String line = input.poll();
                push(line == null ? new Value.Str("") : parseInput(line));
                return false;
            }
            default -> {
                Integer target = labels.get(name);
                if (target == null) throw fail("Unknown function '" + name + "'");
                if (stack.size() < argc) throw fail("Stack underflow calling '" + name + "'");

                // popped last-argument-first
                Value[] args = new Value[argc];
                for (int i = argc - 1; i >= 0; i--) args[i] = pop();

                callStack.push(new Frame(name, ip + 1, Arrays.asList(args)));
                ip = target;
                return true;
            }
        }
    }

    // float when the line contains a dot, else int, else the raw text
    static Value parseInput(String line) {
        String s = line.trim();
        try {
            if (s.contains(".")) return new Value.Float(Double.parseDouble(s));
            return new Value.Int(Long.parseLong(s));
        } catch (NumberFormatException e) {
            return new Value.Str(line);
        }
    }

    private Value arithmetic(Opcode op, Value l, Value r) {
        if (op == Opcode.ADD && (l instanceof Value.Str || r instanceof Value.Str)) {
            return new Value.Str(l.text() + r.text());
        }
        if (!l.isNumeric() || !r.isNumeric()) {
            throw fail("Unsupported operand types for " + op + ": " + l.typeName() + " and " + r.typeName());
        }

        if (op == Opcode.DIV && r.asDouble() == 0.0) throw fail("Division by zero");
        if (op == Opcode.MOD && r.asDouble() == 0.0) throw fail("Modulo by zero");

        if (l instanceof Value.Int a && r instanceof Value.Int b) {
            long x = a.v();
            long y = b.v();
            return new Value.Int(switch (op) {
                case ADD -> x + y;
                case SUB -> x - y;
                case MUL -> x * y;
                case DIV -> x / y;
                default -> x % y;
            });
        }

        double x = l.asDouble();
        double y = r.asDouble();
        return new Value.Float(switch (op) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> x / y;
            default -> x % y;
        });
    }

    private static boolean valueEquals(Value l, Value r) {
        if (l instanceof Value.Int a && r instanceof Value.Int b) return a.v() == b.v();
        if (l.isNumeric() && r.isNumeric()) return l.asDouble() == r.asDouble();
        return l.equals(r);
    }

    private boolean compare(Opcode op, Value l, Value r) {
        int c;
        if (l instanceof Value.Int a && r instanceof Value.Int b) {
            c = Long.compare(a.v(), b.v());
        } else if (l.isNumeric() && r.isNumeric()) {
            c = Double.compare(l.asDouble(), r.asDouble());
        } else if (l instanceof Value.Str a && r instanceof Value.Str b) {
            c = a.v().compareTo(b.v());
        } else {
            throw fail("Cannot compare " + l.typeName() + " and " + r.typeName() + " with " + op);
        }
        return switch (op) {
            case LT -> c < 0;
            case GT -> c > 0;
            case LEQ -> c <= 0;
            default -> c >= 0;
        };
    }

    private int resolve(String label) {
        Integer target = labels.get(label);
        if (target == null) throw fail("Unresolved label '" + label + "'");
        return target;
    }

    private int checkAddress(int addr) {
        if (addr < 0 || addr >= memorySize) {
            throw fail("Memory address " + addr + " out of range [0, " + memorySize + ")");
        }
        return addr;
    }

    private void push(Value v) {
        stack.push(v);
    }

    private Value pop() {
        Value v = stack.poll();
        if (v == null) throw fail("Stack underflow");
        return v;
    }

    private VmException fail(String message) {
        log.debug("Runtime error at ip {}: {}", ip, message);
        running = false;
        return new VmException(message, ip, output);
    }
}
