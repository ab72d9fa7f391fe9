package io.github.eutro.cil2ast.ast;

public final class ExpressionStatement extends Statement {
    private final Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    public ExpressionStatement withExpression(Expression expression) {
        return expression == this.expression ? this : new ExpressionStatement(expression);
    }

    @Override
    public Kind getKind() {
        return Kind.EXPRESSION;
    }
}
