package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for a binary operation.
 *
 * @param token    The operator token.
 * @param left     The left operand.
 * @param operator The operator.
 * @param right    The right operand.
 */
public record BinaryExpression(Token token, Expression left, BinaryOperator operator, Expression right)
        implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
