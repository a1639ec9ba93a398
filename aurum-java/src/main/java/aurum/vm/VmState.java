package aurum.vm;

import aurum.bytecode.Value;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Read-only view of a {@link VirtualMachine} for debugging.
 *
 * <p>{@code memory} holds only the slots written so far, keyed by address. {@code stack} and
 * {@code callStack} are listed bottom first; call-stack entries read {@code name@returnAddress}.
 */
public record VmState(
        ImmutableSortedMap<Integer, Value> memory,
        ImmutableList<Value> stack,
        ImmutableList<String> callStack,
        int instructionPointer,
        boolean halted
) {}
