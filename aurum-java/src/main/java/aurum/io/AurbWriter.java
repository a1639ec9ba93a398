package aurum.io;

import aurum.bytecode.CompiledProgram;
import aurum.bytecode.Insn;
import aurum.bytecode.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static aurum.io.AurbFormat.*;

public final class AurbWriter {
    private static final Logger log = LoggerFactory.getLogger(AurbWriter.class);

    private AurbWriter() {}

    // ---- public API ----

    public static void write(Path out, CompiledProgram program) throws IOException {
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(out))) {
            write(os, program);
        }
    }

    public static void write(OutputStream os, CompiledProgram program) throws IOException {
        DataOutputStream d = new DataOutputStream(os);

        // Header
        d.writeInt(MAGIC);
        d.writeShort(VERSION);

        writeMap(d, 'V', 'R', program.variables());
        writeMap(d, 'F', 'N', program.functions());
        writeCode(d, program);

        d.flush();
        log.debug("Wrote {} variables, {} functions, {} instructions ({} bytes)",
                program.variables().size(), program.functions().size(),
                program.instructions().size(), d.size());
    }

    // ---- internals ----

    private static void writeMap(DataOutputStream d, char t1, char t2, Map<String, Integer> map) throws IOException {
        d.writeByte(t1);
        d.writeByte(t2);
        d.writeInt(map.size());
        for (Map.Entry<String, Integer> e : map.entrySet()) {
            writeString(d, e.getKey());
            d.writeInt(e.getValue());
        }
    }

    private static void writeCode(DataOutputStream d, CompiledProgram program) throws IOException {
        d.writeByte('C');
        d.writeByte('D');
        d.writeInt(program.instructions().size());

        for (Insn insn : program.instructions()) {
            writeString(d, insn.op().name());
            d.writeByte(insn.operands().size());
            for (Object operand : insn.operands()) writeOperand(d, operand);
        }
    }

    private static void writeOperand(DataOutputStream d, Object operand) throws IOException {
        if (operand instanceof Integer i) {
            d.writeByte(OPERAND_INT);
            d.writeInt(i);
        } else if (operand instanceof String s) {
            d.writeByte(OPERAND_NAME);
            writeString(d, s);
        } else if (operand instanceof Value.Int v) {
            d.writeByte(CONST_INT);
            d.writeLong(v.v());
        } else if (operand instanceof Value.Float v) {
            d.writeByte(CONST_FLOAT);
            d.writeDouble(v.v());
        } else if (operand instanceof Value.Str v) {
            d.writeByte(CONST_STRING);
            writeString(d, v.v());
        } else if (operand instanceof Value.Bool v) {
            d.writeByte(CONST_BOOL);
            d.writeBoolean(v.v());
        } else if (operand instanceof Value.Null) {
            d.writeByte(CONST_NULL);
        } else {
            throw new IllegalStateException("Unknown operand type: " + operand.getClass());
        }
    }

    private static void writeString(DataOutputStream d, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        d.writeInt(b.length);
        d.write(b);
    }
}
