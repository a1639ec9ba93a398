package aurum.io;

/**
 * Layout of {@code .aurb} files.
 *
 * <pre>
 * magic "AURB"(i32) version(i16)
 * VR count(i32) { name(str) address(i32) }*
 * FN count(i32) { name(str) index(i32) }*
 * CD count(i32) { opcode(str) operandCount(u8) { tag(u8) payload }* }*
 * </pre>
 *
 * Strings are an i32 byte length followed by UTF-8 bytes.
 */
final class AurbFormat {
    static final int MAGIC = 0x41555242;
    static final short VERSION = 1;

    // operand tags
    static final byte OPERAND_INT = 0;
    static final byte OPERAND_NAME = 1;
    static final byte CONST_INT = 2;
    static final byte CONST_FLOAT = 3;
    static final byte CONST_STRING = 4;
    static final byte CONST_BOOL = 5;
    static final byte CONST_NULL = 6;

    private AurbFormat() {}
}
