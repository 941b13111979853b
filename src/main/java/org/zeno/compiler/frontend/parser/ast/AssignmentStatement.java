package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for {@code x = e}.
 *
 * @param name  The assignment target.
 * @param value The assigned expression.
 */
public record AssignmentStatement(Token name, Expression value) implements Statement {

    @Override
    public Token token() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
