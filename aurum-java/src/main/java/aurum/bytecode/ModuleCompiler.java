package aurum.bytecode;

import aurum.ast.Program;
import aurum.ast.decl.FunctionDecl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowers a checked {@link Program} to stack code.
 *
 * <p>Memory addresses are handed out by name across the whole program, not per function, so
 * every activation of a recursive function shares the same slots. Arguments survive recursion
 * only because the VM keeps them in the call frame.
 */
public final class ModuleCompiler {

    public CompiledProgram compileProgram(Program program) {
        Emitter out = new Emitter();
        Map<String, Integer> addresses = new LinkedHashMap<>();
        Map<String, Integer> functions = new LinkedHashMap<>();

        out.emit(Opcode.CALL, "main", 0);
        out.emit(Opcode.HALT);

        for (FunctionDecl fn : program.functions()) {
            functions.put(fn.name(), out.pc());
            new SingleFunctionCompiler(out, addresses).compile(fn);
        }

        return new CompiledProgram(out.code(), addresses, functions);
    }
}
