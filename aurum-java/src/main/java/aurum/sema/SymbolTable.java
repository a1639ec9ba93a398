package aurum.sema;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

// Scopes live in an arena and point at their parent by handle.
public final class SymbolTable {
    public static final int GLOBAL = 0;

    private final List<Scope> scopes = new ArrayList<>();

    public SymbolTable() {
        scopes.add(new Scope(Scope.NO_PARENT));
    }

    public int newScope(int parent) {
        checkHandle(parent);
        scopes.add(new Scope(parent));
        return scopes.size() - 1;
    }

    // false if the name is already bound in that scope
    public boolean define(int scope, Symbol sym) {
        checkHandle(scope);
        return scopes.get(scope).define(sym);
    }

    public Symbol lookupLocal(int scope, String name) {
        checkHandle(scope);
        return scopes.get(scope).getLocal(name);
    }

    public Symbol lookup(int scope, String name) {
        checkHandle(scope);
        for (int s = scope; s != Scope.NO_PARENT; s = scopes.get(s).parent()) {
            Symbol sym = scopes.get(s).getLocal(name);
            if (sym != null) return sym;
        }
        return null;
    }

    public int size() {
        return scopes.size();
    }

    private void checkHandle(int scope) {
        Preconditions.checkElementIndex(scope, scopes.size(), "scope handle");
    }
}
