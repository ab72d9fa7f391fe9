package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

/**
 * Simple and compound assignment operators.
 */
public enum AssignmentOperatorType {
    ASSIGN(null),
    ADD(BinaryOperatorType.ADD),
    SUBTRACT(BinaryOperatorType.SUBTRACT),
    MULTIPLY(BinaryOperatorType.MULTIPLY),
    DIVIDE(BinaryOperatorType.DIVIDE),
    MODULUS(BinaryOperatorType.MODULUS),
    SHIFT_LEFT(BinaryOperatorType.SHIFT_LEFT),
    SHIFT_RIGHT(BinaryOperatorType.SHIFT_RIGHT),
    BITWISE_AND(BinaryOperatorType.BITWISE_AND),
    BITWISE_OR(BinaryOperatorType.BITWISE_OR),
    EXCLUSIVE_OR(BinaryOperatorType.EXCLUSIVE_OR),
    ;

    @Nullable
    private final BinaryOperatorType binaryOperator;

    AssignmentOperatorType(@Nullable BinaryOperatorType binaryOperator) {
        this.binaryOperator = binaryOperator;
    }

    /**
     * Get the binary operator a compound assignment applies.
     *
     * @return The operator, or null for {@link #ASSIGN}.
     */
    public @Nullable BinaryOperatorType getBinaryOperator() {
        return binaryOperator;
    }

    public String getToken() {
        return binaryOperator == null ? "=" : binaryOperator.getToken() + "=";
    }

    /**
     * Get the compound assignment for a binary operator.
     *
     * @param op The binary operator.
     * @return The compound assignment, or null if the operator has none.
     */
    public static @Nullable AssignmentOperatorType compoundOf(BinaryOperatorType op) {
        for (AssignmentOperatorType type : values()) {
            if (type.binaryOperator == op) return type;
        }
        return null;
    }
}
