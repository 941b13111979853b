package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * A brace-delimited statement sequence. Each block introduces a lexical scope.
 *
 * @param token      The opening brace.
 * @param statements The statements in source order.
 */
public record Block(Token token, List<Statement> statements) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
