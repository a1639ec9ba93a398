package aurum.bytecode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

// functions maps each name to the index of its LABEL instruction
public record CompiledProgram(
        ImmutableList<Insn> instructions,
        ImmutableMap<String, Integer> variables,
        ImmutableMap<String, Integer> functions
) {
    public CompiledProgram(List<Insn> instructions, Map<String, Integer> variables, Map<String, Integer> functions) {
        this(ImmutableList.copyOf(instructions), ImmutableMap.copyOf(variables), ImmutableMap.copyOf(functions));
    }

    public String listing() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < instructions.size(); i++) {
            sb.append(String.format("%4d  %s%n", i, instructions.get(i)));
        }
        return sb.toString();
    }
}
