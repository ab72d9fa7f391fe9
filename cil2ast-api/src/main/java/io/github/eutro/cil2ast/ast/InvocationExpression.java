package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.Symbol;

import java.util.List;

/**
 * A method call. Static calls have a {@link TypeReferenceExpression} target.
 */
public final class InvocationExpression extends Expression {
    private final Expression target;
    private final Symbol method;
    private final List<Expression> arguments;

    public InvocationExpression(Expression target, Symbol method, List<Expression> arguments) {
        this.target = target;
        this.method = method;
        this.arguments = Nodes.copy(arguments);
    }

    public Expression getTarget() {
        return target;
    }

    public Symbol getMethod() {
        return method;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public InvocationExpression with(Expression target, List<Expression> arguments) {
        if (target == this.target && Nodes.sameElements(arguments, this.arguments)) return this;
        return new InvocationExpression(target, method, arguments);
    }

    @Override
    public Kind getKind() {
        return Kind.INVOCATION;
    }
}
