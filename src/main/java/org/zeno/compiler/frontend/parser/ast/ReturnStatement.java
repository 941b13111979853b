package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for {@code return} with an optional value.
 *
 * @param token The {@code return} keyword.
 * @param value The returned expression, or null for a bare return.
 */
public record ReturnStatement(Token token, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
