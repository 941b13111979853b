package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.TokenType;

import java.util.Optional;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<UnaryOperator> fromToken(TokenType type) {
        return switch (type) {
            case MINUS -> Optional.of(NEGATE);
            case BANG -> Optional.of(NOT);
            default -> Optional.empty();
        };
    }
}
