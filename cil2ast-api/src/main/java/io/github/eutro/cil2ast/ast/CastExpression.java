package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;

public final class CastExpression extends Expression {
    private final TypeRef type;
    private final Expression expression;

    public CastExpression(TypeRef type, Expression expression) {
        this.type = type;
        this.expression = expression;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getExpression() {
        return expression;
    }

    public CastExpression withExpression(Expression expression) {
        return expression == this.expression ? this : new CastExpression(type, expression);
    }

    @Override
    public Kind getKind() {
        return Kind.CAST;
    }
}
