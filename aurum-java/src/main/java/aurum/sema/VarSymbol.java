package aurum.sema;

import aurum.types.Type;

public record VarSymbol(String name, Type type, int line) implements Symbol {}
