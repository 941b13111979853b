package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

public record BooleanLiteral(Token token, boolean value) implements Expression {
}
