package aurum.ast.decl;

import aurum.ast.stmt.Block;
import aurum.types.Type;

import java.util.List;

public record FunctionDecl(
        String name,
        List<Param> params,
        Type returnType,
        Block body,
        int line
) {
    public record Param(String name, Type type, int line) {}
}
