package aurum.bytecode;

/**
 * Stack machine instruction set. Each opcode fixes the kinds of its operands:
 * {@code I} an integer (address, index or count), {@code S} a label or function name,
 * {@code V} a constant {@link Value}.
 */
public enum Opcode {
    LOAD_CONST("V"),
    LOAD("I"),          // push memory[addr]
    STORE("I"),         // memory[addr] = pop
    STORE_PARAM("II"),  // memory[addr] = frame.args[index]

    ADD(""), SUB(""), MUL(""), DIV(""), MOD(""),
    NEG(""),
    EQ(""), NEQ(""), LT(""), GT(""), LEQ(""), GEQ(""),
    AND(""), OR(""), NOT(""),

    JUMP("S"),
    JUMP_IF_FALSE("S"),
    LABEL("S"),

    CALL("SI"),         // name, argc
    RETURN(""),
    RETURN_VALUE(""),
    ENTER("I"),         // param count, marker only
    LEAVE(""),

    POP(""),
    HALT("");

    private final String signature;

    Opcode(String signature) {
        this.signature = signature;
    }

    public String signature() {
        return signature;
    }

    public int arity() {
        return signature.length();
    }
}
