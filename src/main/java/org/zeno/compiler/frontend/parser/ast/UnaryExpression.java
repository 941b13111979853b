package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

public record UnaryExpression(Token token, UnaryOperator operator, Expression operand) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
