package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

public record WhileStatement(Token token, Expression condition, Block body) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
