package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

/**
 * Binary operators, with their C# token, precedence and the name of the user-defined
 * operator method that implements them.
 */
public enum BinaryOperatorType {
    MULTIPLY("*", 13, "op_Multiply"),
    DIVIDE("/", 13, "op_Division"),
    MODULUS("%", 13, "op_Modulus"),
    ADD("+", 12, "op_Addition"),
    SUBTRACT("-", 12, "op_Subtraction"),
    SHIFT_LEFT("<<", 11, "op_LeftShift"),
    SHIFT_RIGHT(">>", 11, "op_RightShift"),
    LESS_THAN("<", 10, "op_LessThan"),
    GREATER_THAN(">", 10, "op_GreaterThan"),
    LESS_THAN_OR_EQUAL("<=", 10, "op_LessThanOrEqual"),
    GREATER_THAN_OR_EQUAL(">=", 10, "op_GreaterThanOrEqual"),
    EQUALITY("==", 9, "op_Equality"),
    INEQUALITY("!=", 9, "op_Inequality"),
    BITWISE_AND("&", 8, "op_BitwiseAnd"),
    EXCLUSIVE_OR("^", 7, "op_ExclusiveOr"),
    BITWISE_OR("|", 6, "op_BitwiseOr"),
    CONDITIONAL_AND("&&", 5, null),
    CONDITIONAL_OR("||", 4, null),
    ;

    private final String token;
    private final int precedence;
    @Nullable
    private final String operatorMethodName;

    BinaryOperatorType(String token, int precedence, @Nullable String operatorMethodName) {
        this.token = token;
        this.precedence = precedence;
        this.operatorMethodName = operatorMethodName;
    }

    public String getToken() {
        return token;
    }

    public int getPrecedence() {
        return precedence;
    }

    public @Nullable String getOperatorMethodName() {
        return operatorMethodName;
    }

    /**
     * Whether this is a relational or equality operator.
     *
     * @return Whether this compares its operands.
     */
    public boolean isComparison() {
        return precedence == 9 || precedence == 10;
    }

    /**
     * Get the operator that yields the logical negation of this comparison.
     *
     * @return The negated operator, or null if this is not a comparison.
     */
    public @Nullable BinaryOperatorType negate() {
        switch (this) {
            case LESS_THAN:
                return GREATER_THAN_OR_EQUAL;
            case GREATER_THAN:
                return LESS_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL:
                return GREATER_THAN;
            case GREATER_THAN_OR_EQUAL:
                return LESS_THAN;
            case EQUALITY:
                return INEQUALITY;
            case INEQUALITY:
                return EQUALITY;
            default:
                return null;
        }
    }

    /**
     * Get the operator with its operands swapped, such that {@code a op b == b op.swap() a}.
     *
     * @return The swapped operator, or null if this is not a comparison.
     */
    public @Nullable BinaryOperatorType swap() {
        switch (this) {
            case LESS_THAN:
                return GREATER_THAN;
            case GREATER_THAN:
                return LESS_THAN;
            case LESS_THAN_OR_EQUAL:
                return GREATER_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL:
                return LESS_THAN_OR_EQUAL;
            case EQUALITY:
            case INEQUALITY:
                return this;
            default:
                return null;
        }
    }

    /**
     * Find the operator implemented by a user-defined operator method.
     *
     * @param methodName The method name, e.g. {@code op_Addition}.
     * @return The operator, or null if there is none.
     */
    public static @Nullable BinaryOperatorType byOperatorMethodName(String methodName) {
        for (BinaryOperatorType type : values()) {
            if (methodName.equals(type.operatorMethodName)) return type;
        }
        return null;
    }
}
