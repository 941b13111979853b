package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * AST node for {@code if}.
 *
 * @param token       The {@code if} keyword.
 * @param condition   The condition.
 * @param consequence The block executed when the condition holds.
 * @param alternative Either a {@link Block} or a nested {@link IfStatement} for {@code else if},
 *                    or null when there is no else branch.
 */
public record IfStatement(Token token, Expression condition, Block consequence, Statement alternative)
        implements Statement {

    public IfStatement {
        if (alternative != null && !(alternative instanceof Block) && !(alternative instanceof IfStatement)) {
            throw new IllegalArgumentException("else branch must be a block or an if statement");
        }
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(condition, consequence));
        if (alternative != null) {
            children.add(alternative);
        }
        return children;
    }
}
