package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

public record FloatLiteral(Token token, double value) implements Expression {
}
