package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

public final class ReturnStatement extends Statement {
    public static final ReturnStatement VOID = new ReturnStatement(null);

    @Nullable
    private final Expression expression;

    public ReturnStatement(@Nullable Expression expression) {
        this.expression = expression;
    }

    public @Nullable Expression getExpression() {
        return expression;
    }

    public ReturnStatement withExpression(@Nullable Expression expression) {
        return expression == this.expression ? this : new ReturnStatement(expression);
    }

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }
}
