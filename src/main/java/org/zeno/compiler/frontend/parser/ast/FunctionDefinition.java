package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * AST node for a function definition.
 *
 * @param token      The {@code fn} keyword (or {@code pub} when present).
 * @param name       The function name.
 * @param isPublic   Whether the function is marked {@code pub}.
 * @param parameters The parameters; only the last one may be variadic.
 * @param returnType The declared return type, or null if none.
 * @param body       The function body.
 */
public record FunctionDefinition(
        Token token,
        Token name,
        boolean isPublic,
        List<Parameter> parameters,
        Token returnType,
        Block body
) implements Statement {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
    }

    public boolean isVariadic() {
        return !parameters.isEmpty() && parameters.get(parameters.size() - 1).variadic();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }
}
