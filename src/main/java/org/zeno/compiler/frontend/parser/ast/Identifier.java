package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

public record Identifier(Token token) implements Expression {

    public String name() {
        return token.text();
    }
}
