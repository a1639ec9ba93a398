package aurum.bytecode;

import aurum.types.Type;
import com.google.common.base.Preconditions;

public sealed interface Value permits Value.Int, Value.Float, Value.Str, Value.Bool, Value.Null {

    Null NULL = new Null();

    String text();

    String typeName();

    default boolean isNumeric() {
        return this instanceof Int || this instanceof Float;
    }

    default boolean truthy() {
        if (this instanceof Bool b) return b.v();
        if (this instanceof Int i) return i.v() != 0;
        if (this instanceof Float f) return f.v() != 0.0;
        if (this instanceof Str s) return !s.v().isEmpty();
        return false;
    }

    default double asDouble() {
        if (this instanceof Int i) return i.v();
        if (this instanceof Float f) return f.v();
        throw new IllegalStateException(typeName() + " is not numeric");
    }

    static Value defaultFor(Type type) {
        return switch (type) {
            case INT -> new Int(0);
            case FLOAT -> new Float(0.0);
            case STRING -> new Str("");
            case BOOL -> new Bool(false);
            default -> throw new IllegalArgumentException("No default value for " + type);
        };
    }

    record Int(long v) implements Value {
        public String text() { return Long.toString(v); }
        public String typeName() { return "int"; }
        @Override public String toString() { return text(); }
    }

    record Float(double v) implements Value {
        public String text() { return Double.toString(v); }
        public String typeName() { return "float"; }
        @Override public String toString() { return text(); }
    }

    record Str(String v) implements Value {
        public Str {
            Preconditions.checkNotNull(v, "v");
        }

        public String text() { return v; }
        public String typeName() { return "string"; }

        @Override
        public String toString() {
            return '"' + v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
        }
    }

    record Bool(boolean v) implements Value {
        public String text() { return v ? "true" : "false"; }
        public String typeName() { return "bool"; }
        @Override public String toString() { return text(); }
    }

    record Null() implements Value {
        public String text() { return "null"; }
        public String typeName() { return "null"; }
        @Override public String toString() { return text(); }
    }
}
