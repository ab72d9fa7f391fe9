package io.github.eutro.cil2ast.ast;

public final class AssignmentExpression extends Expression {
    private final Expression left;
    private final AssignmentOperatorType operator;
    private final Expression right;

    public AssignmentExpression(Expression left, AssignmentOperatorType operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public AssignmentExpression(Expression left, Expression right) {
        this(left, AssignmentOperatorType.ASSIGN, right);
    }

    public Expression getLeft() {
        return left;
    }

    public AssignmentOperatorType getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public AssignmentExpression with(Expression left, Expression right) {
        return left == this.left && right == this.right ? this : new AssignmentExpression(left, operator, right);
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGNMENT;
    }
}
