package aurum.sema;

import java.util.HashMap;
import java.util.Map;

final class Scope {
    static final int NO_PARENT = -1;

    private final int parent;
    private final Map<String, Symbol> symbols = new HashMap<>();

    Scope(int parent) {
        this.parent = parent;
    }

    int parent() {
        return parent;
    }

    boolean define(Symbol sym) {
        return symbols.putIfAbsent(sym.name(), sym) == null;
    }

    Symbol getLocal(String name) {
        return symbols.get(name);
    }
}
