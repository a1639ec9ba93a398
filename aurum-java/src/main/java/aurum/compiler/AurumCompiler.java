package aurum.compiler;

import aurum.ast.Program;
import aurum.bytecode.CodeGenException;
import aurum.bytecode.CompiledProgram;
import aurum.bytecode.ModuleCompiler;
import aurum.lexer.Lexer;
import aurum.lexer.LexerException;
import aurum.lexer.Token;
import aurum.parser.ParseException;
import aurum.parser.Parser;
import aurum.sema.SemanticError;
import aurum.sema.TypeChecker;
import aurum.vm.VirtualMachine;
import aurum.vm.VmException;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs the whole pipeline: lexer, parser, type checker, code generator and VM.
 *
 * <p>Phase failures are reported in the returned results as strings prefixed with the phase
 * name; nothing is thrown for bad source or a failing program.
 */
public final class AurumCompiler {
    private static final Logger log = LoggerFactory.getLogger(AurumCompiler.class);

    private final int memorySize;

    public AurumCompiler() {
        this(VirtualMachine.DEFAULT_MEMORY_SIZE);
    }

    public AurumCompiler(int memorySize) {
        Preconditions.checkArgument(memorySize > 0, "memory size must be positive: %s", memorySize);
        this.memorySize = memorySize;
    }

    public CompilationResult compile(String source) {
        return compile(source, phase -> {});
    }

    // progress gets a one-line summary after each phase that succeeds
    public CompilationResult compile(String source, Consumer<String> progress) {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkNotNull(progress, "progress");
        Stopwatch total = Stopwatch.createStarted();

        List<Token> tokens;
        Program program;
        try {
            Stopwatch sw = Stopwatch.createStarted();
            tokens = new Lexer(source).tokenize();
            log.debug("Lexer: {} tokens in {}", tokens.size(), sw);
            progress.accept("Lexer: " + tokens.size() + " tokens");
        } catch (LexerException e) {
            return CompilationResult.failed(List.of("Lexical error: " + e.getMessage()));
        }

        try {
            Stopwatch sw = Stopwatch.createStarted();
            program = new Parser(tokens).parseProgram();
            log.debug("Parser: {} functions in {}", program.functions().size(), sw);
            progress.accept("Parser: " + program.functions().size() + " functions");
        } catch (ParseException e) {
            return CompilationResult.failed(List.of("Syntax error: " + e.getMessage()));
        }

        Stopwatch sw = Stopwatch.createStarted();
        List<SemanticError> semanticErrors = new TypeChecker().check(program);
        log.debug("Type checker: {} error(s) in {}", semanticErrors.size(), sw);
        if (!semanticErrors.isEmpty()) {
            return CompilationResult.failed(semanticErrors.stream()
                    .map(err -> "Semantic error: " + err)
                    .collect(Collectors.toList()));
        }
        progress.accept("Type checker: OK");

        CompiledProgram compiled;
        try {
            sw = Stopwatch.createStarted();
            compiled = new ModuleCompiler().compileProgram(program);
            log.debug("Code generator: {} instructions in {}", compiled.instructions().size(), sw);
            progress.accept("Bytecode: " + compiled.instructions().size() + " instructions");
        } catch (CodeGenException e) {
            return CompilationResult.failed(List.of("Code generation error: " + e.getMessage()));
        }

        log.debug("Compiled in {}", total);
        return CompilationResult.ok(compiled, List.of());
    }

    public ExecutionResult execute(CompilationResult compilation, List<String> input) {
        Preconditions.checkNotNull(compilation, "compilation");
        if (!compilation.success() || compilation.program().isEmpty()) {
            List<String> errors = compilation.errors().isEmpty()
                    ? List.of("Cannot execute a failed compilation")
                    : compilation.errors();
            return new ExecutionResult(false, List.of(), errors, Duration.ZERO);
        }
        return run(compilation.program().get(), input);
    }

    public ExecutionResult run(CompiledProgram program, List<String> input) {
        Preconditions.checkNotNull(program, "program");
        VirtualMachine vm = new VirtualMachine(memorySize);
        Stopwatch sw = Stopwatch.createStarted();
        try {
            vm.loadProgram(program);
            vm.setInput(input);
            List<String> output = vm.execute();
            log.debug("Executed in {}", sw);
            return new ExecutionResult(true, output, List.of(), sw.elapsed());
        } catch (VmException e) {
            log.debug("Execution failed after {}: {}", sw, e.getMessage());
            return new ExecutionResult(false, e.output(), List.of("Runtime error: " + e.getMessage()), sw.elapsed());
        }
    }

    public ExecutionResult compileAndRun(String source, List<String> input) {
        return execute(compile(source), input);
    }
}
