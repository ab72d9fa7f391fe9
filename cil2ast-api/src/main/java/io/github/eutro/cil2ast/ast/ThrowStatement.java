package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

/**
 * {@code throw expression;}, or a rethrow if the expression is null.
 */
public final class ThrowStatement extends Statement {
    public static final ThrowStatement RETHROW = new ThrowStatement(null);

    @Nullable
    private final Expression expression;

    public ThrowStatement(@Nullable Expression expression) {
        this.expression = expression;
    }

    public @Nullable Expression getExpression() {
        return expression;
    }

    public ThrowStatement withExpression(@Nullable Expression expression) {
        return expression == this.expression ? this : new ThrowStatement(expression);
    }

    @Override
    public Kind getKind() {
        return Kind.THROW;
    }
}
