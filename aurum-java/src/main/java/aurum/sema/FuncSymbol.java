package aurum.sema;

import aurum.types.Type;

import java.util.List;

public record FuncSymbol(String name, List<Type> paramTypes, Type returnType, int line) implements Symbol {}
