package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.TokenType;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators with their binding power. All binary operators are left-associative.
 */
public enum BinaryOperator {
    OR("||", TokenType.OR, Precedence.OR),
    AND("&&", TokenType.AND, Precedence.AND),
    EQ("==", TokenType.EQ, Precedence.EQUALS),
    NOT_EQ("!=", TokenType.NOT_EQ, Precedence.EQUALS),
    LT("<", TokenType.LT, Precedence.COMPARISON),
    LT_EQ("<=", TokenType.LT_EQ, Precedence.COMPARISON),
    GT(">", TokenType.GT, Precedence.COMPARISON),
    GT_EQ(">=", TokenType.GT_EQ, Precedence.COMPARISON),
    ADD("+", TokenType.PLUS, Precedence.SUM),
    SUBTRACT("-", TokenType.MINUS, Precedence.SUM),
    MULTIPLY("*", TokenType.ASTERISK, Precedence.PRODUCT),
    DIVIDE("/", TokenType.SLASH, Precedence.PRODUCT),
    MODULO("%", TokenType.PERCENT, Precedence.PRODUCT);

    private final String symbol;
    private final TokenType tokenType;
    private final Precedence precedence;

    BinaryOperator(String symbol, TokenType tokenType, Precedence precedence) {
        this.symbol = symbol;
        this.tokenType = tokenType;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public Precedence precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == Precedence.EQUALS || precedence == Precedence.COMPARISON;
    }

    public boolean isLogical() {
        return this == OR || this == AND;
    }

    /**
     * Decides whether an operand of this operator must be parenthesized to keep its grouping.
     * Operators of lower binding power always need grouping; operators of equal binding power
     * need it only on the right, since all binary operators associate to the left.
     *
     * @param operand      The operand expression.
     * @param rightOperand Whether the operand is on the right-hand side.
     * @return true if the operand must be printed in parentheses.
     */
    public boolean requiresGrouping(Expression operand, boolean rightOperand) {
        if (!(operand instanceof BinaryExpression binary)) {
            return false;
        }
        int cmp = binary.operator().precedence().compareTo(precedence);
        return cmp < 0 || (cmp == 0 && rightOperand);
    }

    /**
     * Finds the binary operator spelled by the given token type.
     * @param type The token type.
     * @return The operator, or empty if the token is not a binary operator.
     */
    public static Optional<BinaryOperator> fromToken(TokenType type) {
        return Arrays.stream(values()).filter(op -> op.tokenType == type).findFirst();
    }
}
