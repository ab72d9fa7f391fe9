package io.github.eutro.cil2ast.ast;

public final class UnaryOperatorExpression extends Expression {
    private final UnaryOperatorType operator;
    private final Expression operand;

    public UnaryOperatorExpression(UnaryOperatorType operator, Expression operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperatorType getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public UnaryOperatorExpression withOperand(Expression operand) {
        return operand == this.operand ? this : new UnaryOperatorExpression(operator, operand);
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY_OPERATOR;
    }
}
