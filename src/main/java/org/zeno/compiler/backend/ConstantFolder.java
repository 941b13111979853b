package org.zeno.compiler.backend;

import org.zeno.compiler.frontend.parser.ast.BinaryOperator;
import org.zeno.compiler.frontend.parser.ast.UnaryOperator;

/**
 * Evaluates the emitted expressions that javac treats as constant expressions.
 * <p>
 * Values are {@link Long}, {@link Double} or {@link Boolean}; null means the expression is not
 * constant. Results follow Java arithmetic, so an integer division by zero is not constant.
 */
final class ConstantFolder {

    private ConstantFolder() {}

    static Object unary(UnaryOperator operator, Object operand) {
        if (operator == UnaryOperator.NOT) {
            return operand instanceof Boolean b ? !b : null;
        }
        if (operand instanceof Long l) return -l;
        if (operand instanceof Double d) return -d;
        return null;
    }

    static Object binary(BinaryOperator operator, Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return switch (operator) {
                case AND -> l && r;
                case OR -> l || r;
                case EQ -> l.booleanValue() == r.booleanValue();
                case NOT_EQ -> l.booleanValue() != r.booleanValue();
                default -> null;
            };
        }
        if (!(left instanceof Number l) || !(right instanceof Number r)) {
            return null;
        }
        if (l instanceof Double || r instanceof Double) {
            return floating(operator, l.doubleValue(), r.doubleValue());
        }
        return integral(operator, l.longValue(), r.longValue());
    }

    private static Object floating(BinaryOperator operator, double l, double r) {
        return switch (operator) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> l / r;
            case MODULO -> l % r;
            case EQ -> l == r;
            case NOT_EQ -> l != r;
            case LT -> l < r;
            case LT_EQ -> l <= r;
            case GT -> l > r;
            case GT_EQ -> l >= r;
            default -> null;
        };
    }

    private static Object integral(BinaryOperator operator, long l, long r) {
        if ((operator == BinaryOperator.DIVIDE || operator == BinaryOperator.MODULO) && r == 0L) {
            return null;
        }
        return switch (operator) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> l / r;
            case MODULO -> l % r;
            case EQ -> l == r;
            case NOT_EQ -> l != r;
            case LT -> l < r;
            case LT_EQ -> l <= r;
            case GT -> l > r;
            case GT_EQ -> l >= r;
            default -> null;
        };
    }
}
