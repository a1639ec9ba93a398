package aurum.io;

import aurum.bytecode.CompiledProgram;
import aurum.bytecode.Insn;
import aurum.bytecode.Opcode;
import aurum.bytecode.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static aurum.io.AurbFormat.*;

public final class AurbReader {
    private static final Logger log = LoggerFactory.getLogger(AurbReader.class);

    private static final int CHUNK = 8192;

    private AurbReader() {}

    public static CompiledProgram read(Path path) throws IOException {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            return read(is);
        }
    }

    public static CompiledProgram read(InputStream is) throws IOException {
        DataInputStream d = new DataInputStream(is);
        try {
            return readProgram(d);
        } catch (EOFException e) {
            throw new AurbFormatException("Unexpected end of file", e);
        }
    }

    private static CompiledProgram readProgram(DataInputStream d) throws IOException {
        int magic = d.readInt();
        if (magic != MAGIC) throw new AurbFormatException("Invalid magic 0x" + Integer.toHexString(magic));

        short version = d.readShort();
        if (version != VERSION) throw new AurbFormatException("Unsupported version " + version);

        Map<String, Integer> variables = readMap(d, 'V', 'R');
        Map<String, Integer> functions = readMap(d, 'F', 'N');
        List<Insn> code = readCode(d);

        log.debug("Read {} variables, {} functions, {} instructions",
                variables.size(), functions.size(), code.size());
        return new CompiledProgram(code, variables, functions);
    }

    private static Map<String, Integer> readMap(DataInputStream d, char t1, char t2) throws IOException {
        expectTag(d, t1, t2);
        int n = readCount(d);
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            String name = readString(d);
            map.put(name, d.readInt());
        }
        return map;
    }

    private static List<Insn> readCode(DataInputStream d) throws IOException {
        expectTag(d, 'C', 'D');
        int n = readCount(d);
        List<Insn> code = new ArrayList<>(Math.min(n, CHUNK));

        for (int i = 0; i < n; i++) {
            String name = readString(d);
            Opcode op;
            try {
                op = Opcode.valueOf(name);
            } catch (IllegalArgumentException e) {
                throw new AurbFormatException("Unknown opcode '" + name + "' at instruction " + i, e);
            }

            int argc = d.readUnsignedByte();
            List<Object> operands = new ArrayList<>(argc);
            for (int k = 0; k < argc; k++) operands.add(readOperand(d));

            try {
                code.add(new Insn(op, operands));
            } catch (IllegalArgumentException e) {
                throw new AurbFormatException("Malformed instruction " + i + ": " + e.getMessage(), e);
            }
        }
        return code;
    }

    private static Object readOperand(DataInputStream d) throws IOException {
        byte tag = d.readByte();
        return switch (tag) {
            case OPERAND_INT -> d.readInt();
            case OPERAND_NAME -> readString(d);
            case CONST_INT -> new Value.Int(d.readLong());
            case CONST_FLOAT -> new Value.Float(d.readDouble());
            case CONST_STRING -> new Value.Str(readString(d));
            case CONST_BOOL -> new Value.Bool(d.readBoolean());
            case CONST_NULL -> Value.NULL;
            default -> throw new AurbFormatException("Unknown operand tag: " + tag);
        };
    }

    private static int readCount(DataInputStream d) throws IOException {
        int n = d.readInt();
        if (n < 0) throw new AurbFormatException("Negative count: " + n);
        return n;
    }

    private static void expectTag(DataInputStream d, char c1, char c2) throws IOException {
        byte b1 = d.readByte();
        byte b2 = d.readByte();
        if (b1 != (byte) c1 || b2 != (byte) c2) {
            throw new AurbFormatException(
                    String.format("Expected tag %c%c, got %c%c", c1, c2, (char) b1, (char) b2)
            );
        }
    }

    // lengths come from the file, so buffers grow with the bytes actually read
    private static String readString(DataInputStream d) throws IOException {
        int len = readCount(d);
        byte[] chunk = new byte[Math.min(len, CHUNK)];
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(chunk.length);
        int remaining = len;
        while (remaining > 0) {
            int n = d.read(chunk, 0, Math.min(remaining, chunk.length));
            if (n < 0) {
                throw new AurbFormatException("String of " + len + " bytes runs past the end of file");
            }
            bytes.write(chunk, 0, n);
            remaining -= n;
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
