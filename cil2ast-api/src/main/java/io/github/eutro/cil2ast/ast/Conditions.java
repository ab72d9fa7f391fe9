package io.github.eutro.cil2ast.ast;

/**
 * Helpers for building boolean conditions.
 */
public final class Conditions {
    private Conditions() {
    }

    /**
     * Negate a condition, flipping comparisons and removing double negation instead of wrapping them where possible.
     *
     * @param expr The condition.
     * @return The negated condition.
     */
    public static Expression not(Expression expr) {
        switch (expr.getKind()) {
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
                if (unary.getOperator() == UnaryOperatorType.NOT) return unary.getOperand();
                break;
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
                BinaryOperatorType negated = binary.getOperator().negate();
                if (negated != null) {
                    return new BinaryOperatorExpression(binary.getLeft(), negated, binary.getRight());
                }
                break;
            }
            case PRIMITIVE: {
                Object value = ((PrimitiveExpression) expr).getValue();
                if (value instanceof Boolean) {
                    return (Boolean) value ? PrimitiveExpression.FALSE : PrimitiveExpression.TRUE;
                }
                break;
            }
            default:
                break;
        }
        return new UnaryOperatorExpression(UnaryOperatorType.NOT, expr);
    }
}
