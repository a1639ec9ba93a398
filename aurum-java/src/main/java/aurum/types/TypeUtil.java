package aurum.types;

public final class TypeUtil {
    private TypeUtil() {}

    // exact match; any accepts every non-void value
    public static boolean isAssignable(Type dst, Type src) {
        if (dst == Type.ANY) return src != Type.VOID;
        return dst == src;
    }

    public static Type numericResult(Type a, Type b) {
        if (!a.isNumeric() || !b.isNumeric()) return null;
        return (a == Type.FLOAT || b == Type.FLOAT) ? Type.FLOAT : Type.INT;
    }

    public static boolean isComparable(Type a, Type b) {
        if (a == Type.VOID || b == Type.VOID) return false;
        return a == b || (a.isNumeric() && b.isNumeric());
    }
}
