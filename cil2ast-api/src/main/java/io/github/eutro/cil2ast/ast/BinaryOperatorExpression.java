package io.github.eutro.cil2ast.ast;

public final class BinaryOperatorExpression extends Expression {
    private final Expression left;
    private final BinaryOperatorType operator;
    private final Expression right;

    public BinaryOperatorExpression(Expression left, BinaryOperatorType operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperatorType getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public BinaryOperatorExpression with(Expression left, Expression right) {
        return left == this.left && right == this.right ? this : new BinaryOperatorExpression(left, operator, right);
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY_OPERATOR;
    }
}
