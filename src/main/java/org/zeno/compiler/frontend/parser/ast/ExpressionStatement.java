package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

public record ExpressionStatement(Token token, Expression expression) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
