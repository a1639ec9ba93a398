package aurum.ast;

import aurum.ast.decl.FunctionDecl;

import java.util.List;
import java.util.Optional;

public record Program(List<FunctionDecl> functions) {

    public Optional<FunctionDecl> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
