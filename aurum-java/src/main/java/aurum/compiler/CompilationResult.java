package aurum.compiler;

import aurum.bytecode.CompiledProgram;

import java.util.List;
import java.util.Optional;

public record CompilationResult(
        boolean success,
        List<String> errors,
        List<String> warnings,
        Optional<CompiledProgram> program
) {
    public CompilationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static CompilationResult ok(CompiledProgram program, List<String> warnings) {
        return new CompilationResult(true, List.of(), warnings, Optional.of(program));
    }

    static CompilationResult failed(List<String> errors) {
        return new CompilationResult(false, errors, List.of(), Optional.empty());
    }
}
