package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

public record IntegerLiteral(Token token, long value) implements Expression {
}
