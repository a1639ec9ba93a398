package aurum.bytecode;

import aurum.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleCompilerTest {

    private static CompiledProgram compile(String src) {
        return new ModuleCompiler().compileProgram(Parser.parse(src));
    }

    private static List<String> listing(CompiledProgram p) {
        return p.instructions().stream().map(Insn::toString).toList();
    }

    /** Instructions of {@code main} between ENTER and its trailing RETURN/LEAVE. */
    private static List<String> mainBody(String body) {
        var p = compile("func main() -> void {\n" + body + "\n}");
        var all = listing(p);
        int start = p.functions().get("main") + 2;
        return all.subList(start, all.size() - 2);
    }

    @Test
    void compile_hello_program_layout() {
        var p = compile("func main()->void{ print(\"Hi\"); int x=5; print(x+1); }");
        assertEquals(List.of(
                "CALL main 0",
                "HALT",
                "LABEL main",
                "ENTER 0",
                "LOAD_CONST \"Hi\"",
                "CALL print 1",
                "POP",
                "LOAD_CONST 5",
                "STORE 0",
                "LOAD 0",
                "LOAD_CONST 1",
                "ADD",
                "CALL print 1",
                "POP",
                "RETURN",
                "LEAVE"
        ), listing(p));
        assertEquals(Map.of("x", 0), p.variables());
        assertEquals(Map.of("main", 2), p.functions());
    }

    @Test
    void compile_function_map_points_at_own_label() {
        var p = compile("""
            func fact(int n) -> int {
                if (n <= 1) { return 1 } else { return n * fact(n - 1) }
            }
            func main() -> void { print(fact(5)) }
            """);
        for (var e : p.functions().entrySet()) {
            Insn label = p.instructions().get(e.getValue());
            assertEquals(Opcode.LABEL, label.op());
            assertEquals(e.getKey(), label.stringArg(0));
        }
        assertEquals(2, p.functions().get("fact"));
        assertEquals("CALL main 0", p.instructions().get(0).toString());
    }

    @Test
    void compile_prologue_stores_params_and_non_void_has_no_trailing_return() {
        var p = compile("""
            func add(int a, int b) -> int { return a + b }
            func main() -> void { print(add(1, 2)) }
            """);
        assertEquals(List.of(
                "LABEL add",
                "ENTER 2",
                "STORE_PARAM 0 0",
                "STORE_PARAM 1 1",
                "LOAD 0",
                "LOAD 1",
                "ADD",
                "RETURN_VALUE",
                "LEAVE"
        ), listing(p).subList(2, 11));
    }

    @Test
    void compile_call_pushes_arguments_in_source_order() {
        var p = compile("""
            func f(int a, string b) -> void { }
            func main() -> void { f(7, "x") }
            """);
        var code = listing(p);
        int main = p.functions().get("main");
        assertEquals(List.of("LOAD_CONST 7", "LOAD_CONST \"x\"", "CALL f 2", "POP"), code.subList(main + 2, main + 6));
    }

    @Test
    void compile_addresses_are_global_by_name() {
        var p = compile("""
            func f(int n) -> void { int t = n }
            func main() -> void { int n = 1; int u = 2; f(n) }
            """);
        assertEquals(Map.of("n", 0, "t", 1, "u", 2), p.variables());
    }

    @Test
    void compile_declaration_without_initializer_stores_default() {
        assertEquals(List.of(
                "LOAD_CONST 0", "STORE 0",
                "LOAD_CONST 0.0", "STORE 1",
                "LOAD_CONST \"\"", "STORE 2",
                "LOAD_CONST false", "STORE 3"
        ), mainBody("int a\nfloat b\nstring c\nbool d"));
    }

    @Test
    void compile_while_loop() {
        assertEquals(List.of(
                "LOAD_CONST 0", "STORE 0",
                "LABEL .L0",
                "LOAD 0", "LOAD_CONST 3", "LT",
                "JUMP_IF_FALSE .L1",
                "LOAD 0", "LOAD_CONST 1", "ADD", "STORE 0",
                "JUMP .L0",
                "LABEL .L1"
        ), mainBody("int i = 0\nwhile (i < 3) { i = i + 1 }"));
    }

    @Test
    void compile_for_continue_jumps_to_update() {
        assertEquals(List.of(
                "LOAD_CONST 0", "STORE 0",
                "LABEL .L0",
                "LOAD 0", "LOAD_CONST 2", "LT",
                "JUMP_IF_FALSE .L2",
                "JUMP .L1",
                "LABEL .L1",
                "LOAD 0", "LOAD_CONST 1", "ADD", "STORE 0",
                "JUMP .L0",
                "LABEL .L2"
        ), mainBody("for (int i = 0; i < 2; i = i + 1) { continue }"));
    }

    @Test
    void compile_break_targets_innermost_loop() {
        var code = mainBody("while (true) { while (false) { break } break }");
        // outer: .L0 start, .L1 end; inner: .L2 start, .L3 end
        assertEquals(List.of(
                "LABEL .L0", "LOAD_CONST true", "JUMP_IF_FALSE .L1",
                "LABEL .L2", "LOAD_CONST false", "JUMP_IF_FALSE .L3",
                "JUMP .L3",
                "JUMP .L2",
                "LABEL .L3",
                "JUMP .L1",
                "JUMP .L0",
                "LABEL .L1"
        ), code);
    }

    @Test
    void compile_if_elif_else_chain() {
        assertEquals(List.of(
                "LOAD_CONST true", "STORE 0",
                "LOAD 0", "JUMP_IF_FALSE .L1",
                "LOAD_CONST 1", "CALL print 1", "POP",
                "JUMP .L0",
                "LABEL .L1",
                "LOAD 0", "NOT", "JUMP_IF_FALSE .L2",
                "LOAD_CONST 2", "CALL print 1", "POP",
                "JUMP .L0",
                "LABEL .L2",
                "LOAD_CONST 3", "CALL print 1", "POP",
                "LABEL .L0"
        ), mainBody("bool a = true\nif (a) { print(1) } elif (not a) { print(2) } else { print(3) }"));
    }

    @Test
    void compile_operators_map_to_opcodes() {
        var code = mainBody("bool r = 1 - 2 * 3 / 4 % 5 == -6 and 1 != 2 or 1 <= 2 and 1 >= 2 and 1 > 2");
        assertTrue(code.containsAll(List.of("SUB", "MUL", "DIV", "MOD", "NEG", "EQ", "NEQ", "LEQ", "GEQ", "GT", "AND", "OR")));
    }

    @Test
    void compile_break_outside_loop_is_codegen_error() {
        // the type checker would reject this; the generator still refuses it
        var ex = assertThrows(CodeGenException.class, () -> compile("func main() -> void {\n  break\n}"));
        assertEquals(2, ex.line());
    }

    @Test
    void compile_labels_are_unique_across_functions() {
        var p = compile("""
            func f() -> void { while (true) { break } }
            func main() -> void { while (true) { break } }
            """);
        var labels = p.instructions().stream()
                .filter(i -> i.op() == Opcode.LABEL)
                .map(i -> i.stringArg(0))
                .toList();
        assertEquals(List.of("f", ".L0", ".L1", "main", ".L2", ".L3"), labels);
    }

    @Test
    void listing_numbers_instructions() {
        var text = compile("func main() -> void { }").listing();
        assertTrue(text.startsWith("   0  CALL main 0"));
        assertTrue(text.contains("   3  ENTER 0"));
    }

    @Test
    void insn_validates_operands() {
        assertThrows(IllegalArgumentException.class, () -> Insn.of(Opcode.LOAD));
        assertThrows(IllegalArgumentException.class, () -> Insn.of(Opcode.LOAD, "x"));
        assertThrows(IllegalArgumentException.class, () -> Insn.of(Opcode.CALL, "f", new Value.Int(1)));
        assertEquals("STORE_PARAM 1 4", Insn.of(Opcode.STORE_PARAM, 1, 4).toString());
    }
}
