package aurum.cli;

import aurum.bytecode.CompiledProgram;
import aurum.compiler.AurumCompiler;
import aurum.compiler.CompilationResult;
import aurum.compiler.ExecutionResult;
import aurum.io.AurbReader;
import aurum.io.AurbWriter;
import aurum.vm.VirtualMachine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code aurum <input.auro> [output.aurb]} compiles to an artifact.
 * {@code aurum run <file.auro|file.aurb> [--input <file>] [--memory <slots>]} executes.
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: aurum <input.auro> [output.aurb]",
            "       aurum run <file.auro|file.aurb> [--input <file>] [--memory <slots>]");

    private final PrintStream out;
    private final PrintStream err;

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    int run(String[] args) {
        if (args.length < 1) return usage(null);
        try {
            if (args[0].equals("run")) return runProgram(args);
            if (args.length > 2) return usage("Too many arguments");
            return compile(args);
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int usage(String problem) {
        if (problem != null) err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    // ---- aurum <input> [output] ----

    private int compile(String[] args) throws IOException {
        Path input = Path.of(args[0]);
        Path output = (args.length >= 2)
                ? Path.of(args[1])
                : Path.of(input.toString().replaceFirst("\\.auro$", "") + ".aurb");

        // 1. Read
        String source = Files.readString(input);
        out.println("[1/5] Reading: " + input);

        // 2-5. Lexer, parser, type checker, code generator
        int[] phase = {1};
        CompilationResult compilation = new AurumCompiler()
                .compile(source, summary -> out.println("[" + ++phase[0] + "/5] " + summary));
        if (!compilation.success()) {
            compilation.errors().forEach(err::println);
            return EXIT_FAILURE;
        }
        CompiledProgram compiled = compilation.program().orElseThrow();

        AurbWriter.write(output, compiled);

        out.println();
        out.println("Success: " + output);
        out.println("  Functions:    " + compiled.functions().size());
        out.println("  Variables:    " + compiled.variables().size());
        out.println("  Instructions: " + compiled.instructions().size());
        out.println("  File size:    " + Files.size(output) + " bytes");
        return EXIT_OK;
    }

    // ---- aurum run <file> [options] ----

    private int runProgram(String[] args) throws IOException {
        Path file = null;
        Path inputFile = null;
        int memory = VirtualMachine.DEFAULT_MEMORY_SIZE;

        for (int i = 1; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--input") || a.equals("--memory")) {
                if (i + 1 >= args.length) return usage("Missing value for " + a);
                String value = args[++i];
                if (a.equals("--input")) {
                    inputFile = Path.of(value);
                } else {
                    try {
                        memory = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        return usage("Invalid --memory value: " + value);
                    }
                    if (memory <= 0) return usage("--memory must be positive");
                }
            } else if (a.startsWith("--")) {
                return usage("Unknown option " + a);
            } else if (file == null) {
                file = Path.of(a);
            } else {
                return usage("Too many arguments");
            }
        }
        if (file == null) return usage("Missing program file");

        List<String> input = inputFile == null ? List.of() : Files.readAllLines(inputFile);
        AurumCompiler compiler = new AurumCompiler(memory);

        ExecutionResult result;
        if (file.toString().endsWith(".aurb")) {
            result = compiler.run(AurbReader.read(file), input);
        } else {
            CompilationResult compilation = compiler.compile(Files.readString(file));
            if (!compilation.success()) {
                compilation.errors().forEach(err::println);
                return EXIT_FAILURE;
            }
            result = compiler.execute(compilation, input);
        }

        result.output().forEach(out::println);
        result.errors().forEach(err::println);
        return result.success() ? EXIT_OK : EXIT_FAILURE;
    }
}
