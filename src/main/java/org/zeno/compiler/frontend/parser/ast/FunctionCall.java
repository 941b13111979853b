package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for a call {@code name(args...)}.
 *
 * @param callee    The called name.
 * @param arguments The argument expressions in evaluation order.
 */
public record FunctionCall(Token callee, List<Expression> arguments) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Token token() {
        return callee;
    }

    public String name() {
        return callee.text();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
