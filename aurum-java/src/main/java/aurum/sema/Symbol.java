package aurum.sema;

public sealed interface Symbol permits VarSymbol, FuncSymbol {
    String name();

    int line();
}
