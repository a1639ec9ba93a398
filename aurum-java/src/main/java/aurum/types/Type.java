package aurum.types;

public enum Type {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOL("bool"),
    VOID("void"),
    ANY("any");

    private final String keyword;

    Type(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
