package aurum.cli;

import aurum.bytecode.CompiledProgram;
import aurum.bytecode.Insn;
import aurum.bytecode.Opcode;
import aurum.io.AurbWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @TempDir
    Path dir;

    private int run(String... args) {
        var out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        var err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new Main(out, err).run(args);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }

    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private List<String> outLines() { return out().lines().toList(); }

    private Path source(String name, String text) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, text);
        return p;
    }

    @Test
    void no_arguments_prints_usage() {
        assertEquals(Main.EXIT_USAGE, run());
        assertTrue(err().contains("Usage: aurum"));
    }

    @Test
    void compile_writes_artifact_next_to_source() throws IOException {
        Path src = source("hello.auro", "func main() -> void { print(\"Hi\") }");
        assertEquals(Main.EXIT_OK, run(src.toString()));
        assertTrue(Files.exists(dir.resolve("hello.aurb")));
        assertTrue(out().contains("[1/5] Reading"));
        assertTrue(out().contains("[4/5] Type checker: OK"));
        assertTrue(out().contains("[5/5] Bytecode: "));
        assertTrue(out().contains("Success: "));
    }

    @Test
    void compile_to_explicit_output() throws IOException {
        Path src = source("a.auro", "func main() -> void { }");
        Path target = dir.resolve("out.aurb");
        assertEquals(Main.EXIT_OK, run(src.toString(), target.toString()));
        assertTrue(Files.size(target) > 0);
    }

    @Test
    void compile_reports_semantic_errors() throws IOException {
        Path src = source("bad.auro", "func main() -> void {\n  int x = true\n}");
        assertEquals(Main.EXIT_FAILURE, run(src.toString()));
        assertTrue(err().startsWith("Semantic error: line 2: Cannot assign bool"));
        assertTrue(out().contains("[2/5] Lexer: "));
        assertTrue(out().contains("[3/5] Parser: 1 functions"));
        assertFalse(out().contains("[4/5]"));
        assertFalse(Files.exists(dir.resolve("bad.aurb")));
    }

    @Test
    void compile_reports_syntax_error() throws IOException {
        Path src = source("bad.auro", "func main() -> void {");
        assertEquals(Main.EXIT_FAILURE, run(src.toString()));
        assertTrue(err().startsWith("Syntax error: "));
    }

    @Test
    void run_source_with_input_file() throws IOException {
        Path src = source("greet.auro", """
                func main() -> void {
                    string name = read()
                    int n = read()
                    print("hi " + name)
                }
                """);
        // read() is typed string, so the int declaration is rejected
        assertEquals(Main.EXIT_FAILURE, run("run", src.toString()));
        assertTrue(err().contains("Semantic error"));

        outBytes.reset();
        errBytes.reset();
        Path ok = source("greet2.auro", """
                func main() -> void {
                    print("hi " + read())
                    print(read())
                }
                """);
        Path input = source("in.txt", "zoe\n7\n");
        assertEquals(Main.EXIT_OK, run("run", ok.toString(), "--input", input.toString()));
        assertEquals(List.of("hi zoe", "7"), outLines());
    }

    @Test
    void run_compiled_artifact() throws IOException {
        Path src = source("p.auro", "func main() -> void { print(6 * 7) }");
        Path aurb = dir.resolve("p.aurb");
        assertEquals(Main.EXIT_OK, run(src.toString(), aurb.toString()));

        outBytes.reset();
        assertEquals(Main.EXIT_OK, run("run", aurb.toString()));
        assertEquals(List.of("42"), outLines());
    }

    @Test
    void run_artifact_with_duplicate_labels_fails_cleanly() throws IOException {
        Path aurb = dir.resolve("dup.aurb");
        AurbWriter.write(aurb, new CompiledProgram(List.of(
                Insn.of(Opcode.CALL, "main", 0),
                Insn.of(Opcode.HALT),
                Insn.of(Opcode.LABEL, "main"),
                Insn.of(Opcode.LABEL, "main")
        ), Map.of(), Map.of("main", 2)));

        assertEquals(Main.EXIT_FAILURE, run("run", aurb.toString()));
        assertTrue(err().startsWith("Runtime error: [ip 3] Duplicate label 'main'"));
    }

    @Test
    void run_runtime_error_prints_partial_output() throws IOException {
        Path src = source("div.auro", "func main() -> void { print(\"x\"); int z = 0; print(1 / z) }");
        assertEquals(Main.EXIT_FAILURE, run("run", src.toString()));
        assertEquals(List.of("x"), outLines());
        assertTrue(err().contains("Runtime error"));
    }

    @Test
    void run_with_memory_option() throws IOException {
        Path src = source("m.auro", "func main() -> void { int a = 1; int b = 2 }");
        assertEquals(Main.EXIT_FAILURE, run("run", src.toString(), "--memory", "1"));
        assertEquals(Main.EXIT_OK, run("run", src.toString(), "--memory", "2"));
    }

    @Test
    void run_usage_errors() {
        assertEquals(Main.EXIT_USAGE, run("run"));
        assertEquals(Main.EXIT_USAGE, run("run", "x.auro", "--memory"));
        assertEquals(Main.EXIT_USAGE, run("run", "x.auro", "--memory", "lots"));
        assertEquals(Main.EXIT_USAGE, run("run", "x.auro", "--verbose"));
        assertEquals(Main.EXIT_USAGE, run("run", "x.auro", "y.auro"));
        assertEquals(Main.EXIT_USAGE, run("a.auro", "b.aurb", "c"));
    }

    @Test
    void missing_file_is_failure() {
        assertEquals(Main.EXIT_FAILURE, run("run", dir.resolve("none.auro").toString()));
        assertTrue(err().startsWith("I/O error"));
    }
}
