package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A literal: {@code null}, a boolean, an integer ({@link Integer} or {@link Long}),
 * a {@link Double} or a {@link String}.
 */
public final class PrimitiveExpression extends Expression {
    public static final PrimitiveExpression NULL = new PrimitiveExpression(null);
    public static final PrimitiveExpression TRUE = new PrimitiveExpression(true);
    public static final PrimitiveExpression FALSE = new PrimitiveExpression(false);

    @Nullable
    private final Object value;

    public PrimitiveExpression(@Nullable Object value) {
        this.value = value;
    }

    public static PrimitiveExpression of(int value) {
        return new PrimitiveExpression(value);
    }

    public @Nullable Object getValue() {
        return value;
    }

    /**
     * Whether this literal is an integer of the given value.
     *
     * @param expr  The expression.
     * @param value The value.
     * @return Whether {@code expr} is the integer literal {@code value}.
     */
    public static boolean isInteger(Expression expr, long value) {
        if (expr.getKind() != Kind.PRIMITIVE) return false;
        Object v = ((PrimitiveExpression) expr).value;
        return (v instanceof Integer || v instanceof Long) && ((Number) v).longValue() == value;
    }

    /**
     * Whether this is the literal {@code null}.
     *
     * @param expr The expression.
     * @return Whether it is {@code null}.
     */
    public static boolean isNull(Expression expr) {
        return expr.getKind() == Kind.PRIMITIVE && ((PrimitiveExpression) expr).value == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((PrimitiveExpression) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public Kind getKind() {
        return Kind.PRIMITIVE;
    }
}
