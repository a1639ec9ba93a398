package aurum.compiler;

import aurum.bytecode.CompiledProgram;
import aurum.bytecode.Insn;
import aurum.bytecode.Opcode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AurumCompilerTest {

    private final AurumCompiler compiler = new AurumCompiler();

    private List<String> outputOf(String src, String... input) {
        ExecutionResult r = compiler.compileAndRun(src, List.of(input));
        assertTrue(r.success(), () -> "errors: " + r.errors());
        return r.output();
    }

    @Test
    void hello_program() {
        assertEquals(List.of("Hi", "6"), outputOf("func main()->void{ print(\"Hi\"); int x=5; print(x+1); } "));
    }

    @Test
    void factorial() {
        assertEquals(List.of("120"), outputOf(
                "func fact(int n)->int{ if(n<=1){return 1;} else {return n*fact(n-1);} } "
                        + "func main()->void{ print(fact(5)); }"));
    }

    @Test
    void division_by_zero_compiles_but_fails_at_runtime() {
        CompilationResult c = compiler.compile("func main()->void{ int a=5; int b=0; print(a/b); }");
        assertTrue(c.success());
        assertTrue(c.program().isPresent());

        ExecutionResult r = compiler.execute(c, List.of());
        assertFalse(r.success());
        assertEquals(List.of(), r.output());
        assertEquals(1, r.errors().size());
        assertTrue(r.errors().get(0).startsWith("Runtime error: "));
        assertTrue(r.errors().get(0).contains("Division by zero"));
    }

    @Test
    void runtime_failure_keeps_output_printed_before_it() {
        ExecutionResult r = compiler.compileAndRun("""
                func main() -> void {
                    print("start")
                    int z = 0
                    print(10 % z)
                }
                """, List.of());
        assertFalse(r.success());
        assertEquals(List.of("start"), r.output());
    }

    @Test
    void demo_program() {
        assertEquals(List.of(
                "¡Hola, aurum!",
                "Los números son: 15 y 25",
                "Su suma es: 40",
                "La suma es mayor a 30",
                "El factorial de 5 es: 120"
        ), outputOf("""
                func main() -> void {
                    print("¡Hola, aurum!")

                    int a = 15
                    int b = 25
                    int suma = a + b

                    print("Los números son: " + a + " y " + b)
                    print("Su suma es: " + suma)

                    if (suma > 30) {
                        print("La suma es mayor a 30")
                    } else {
                        print("La suma es menor o igual a 30")
                    }

                    int factorial_5 = factorial(5)
                    print("El factorial de 5 es: " + factorial_5)
                }

                func factorial(int n) -> int {
                    if (n <= 1) {
                        return 1
                    } else {
                        return n * factorial(n - 1)
                    }
                }
                """));
    }

    @Test
    void string_coercion() {
        assertEquals(List.of("n=5"), outputOf("func main()->void{ print(\"n=\" + 5); }"));
    }

    @Test
    void integer_arithmetic_truncates_and_floats_promote() {
        assertEquals(List.of("3", "-3", "1", "3.5", "2.0", "14"), outputOf("""
                func main() -> void {
                    print(7 / 2)
                    print(-7 / 2)
                    print(7 % 3)
                    print(7 / 2.0)
                    print(1.0 * 2)
                    print(2 + 3 * 4)
                }
                """));
    }

    @Test
    void loops_break_and_continue() {
        assertEquals(List.of("1", "3", "5", "done 6"), outputOf("""
                func main() -> void {
                    int i = 0
                    while (true) {
                        i = i + 1
                        if (i > 5) { break }
                        if (i % 2 == 0) { continue }
                        print(i)
                    }
                    print("done " + i)
                }
                """));
    }

    @Test
    void for_loop_continue_runs_update() {
        assertEquals(List.of("0", "1", "3"), outputOf("""
                func main() -> void {
                    for (int i = 0; i < 4; i = i + 1) {
                        if (i == 2) { continue }
                        print(i)
                    }
                }
                """));
    }

    @Test
    void elif_chain_picks_first_true_branch() {
        assertEquals(List.of("neg", "zero", "small", "big"), outputOf("""
                func classify(int n) -> string {
                    if (n < 0) { return "neg" }
                    elif (n == 0) { return "zero" }
                    elif (n < 10) { return "small" }
                    else { return "big" }
                }
                func main() -> void {
                    print(classify(-4))
                    print(classify(0))
                    print(classify(3))
                    print(classify(99))
                }
                """));
    }

    @Test
    void functions_declared_after_use() {
        assertEquals(List.of("true"), outputOf("""
                func main() -> void { print(isEven(10)) }
                func isEven(int n) -> bool { if (n == 0) { return true } else { return isOdd(n - 1) } }
                func isOdd(int n) -> bool { if (n == 0) { return false } else { return isEven(n - 1) } }
                """));
    }

    @Test
    void read_input_lines() {
        assertEquals(List.of("hello ann", "42"), outputOf("""
                func main() -> void {
                    string name = read()
                    print("hello " + name)
                    write(read())
                }
                """, "ann", "42"));
    }

    @Test
    void early_return_from_main_stops_program() {
        assertEquals(List.of("a"), outputOf("""
                func main() -> void {
                    print("a")
                    if (true) { return }
                    print("b")
                }
                """));
    }

    @Test
    void function_named_like_a_generated_label() {
        assertEquals(List.of("in L0", "in L1"), outputOf("""
                func L0() -> void { print("in L0") }
                func L1() -> void { print("in L1") }
                func main() -> void {
                    while (false) { }
                    if (true) { L0() } else { L1() }
                    L1()
                }
                """));
    }

    @Test
    void duplicate_labels_become_runtime_error() {
        CompiledProgram p = new CompiledProgram(List.of(
                Insn.of(Opcode.LABEL, "twice"),
                Insn.of(Opcode.LABEL, "twice")
        ), Map.of(), Map.of());

        ExecutionResult r = compiler.run(p, List.of());
        assertFalse(r.success());
        assertEquals(List.of(), r.output());
        assertTrue(r.errors().get(0).startsWith("Runtime error: [ip 1] Duplicate label 'twice'"));
    }

    @Test
    void lexical_error_reported() {
        CompilationResult c = compiler.compile("func main() -> void { int x = 1 $ 2 }");
        assertFalse(c.success());
        assertTrue(c.program().isEmpty());
        assertEquals(1, c.errors().size());
        assertTrue(c.errors().get(0).startsWith("Lexical error: [1:33]"), c.errors().get(0));
    }

    @Test
    void syntax_error_reported() {
        CompilationResult c = compiler.compile("func main() -> void { int = 2 }");
        assertFalse(c.success());
        assertTrue(c.errors().get(0).startsWith("Syntax error: "));
    }

    @Test
    void missing_main_is_syntax_error() {
        CompilationResult c = compiler.compile("func f() -> void { }");
        assertEquals(List.of("Syntax error: [1:1] Program requires a 'main' function"), c.errors());
    }

    @Test
    void semantic_errors_all_reported() {
        CompilationResult c = compiler.compile("""
                func main() -> void {
                    int x = "s"
                    break
                }
                """);
        assertFalse(c.success());
        assertEquals(List.of(
                "Semantic error: line 2: Cannot assign string to variable 'x' of type int",
                "Semantic error: line 3: 'break' outside of a loop"
        ), c.errors());
        assertEquals(List.of(), c.warnings());
    }

    @Test
    void failed_compilation_is_not_executed() {
        CompilationResult c = compiler.compile("func main() -> void { print(y) }");
        ExecutionResult r = compiler.execute(c, List.of());
        assertFalse(r.success());
        assertEquals(List.of(), r.output());
        assertEquals(c.errors(), r.errors());
        assertEquals(Duration.ZERO, r.elapsedTime());
    }

    @Test
    void small_memory_limit_is_enforced() {
        AurumCompiler tiny = new AurumCompiler(2);
        ExecutionResult r = tiny.compileAndRun("func main() -> void { int a = 1; int b = 2; int c = 3 }", List.of());
        assertFalse(r.success());
        assertTrue(r.errors().get(0).contains("out of range"));
    }

    @Test
    void compiled_program_can_run_repeatedly() {
        CompilationResult c = compiler.compile("func main() -> void { print(read()) }");
        assertEquals(List.of("1"), compiler.execute(c, List.of("1")).output());
        assertEquals(List.of("2.5"), compiler.execute(c, List.of("2.5")).output());
    }
}
