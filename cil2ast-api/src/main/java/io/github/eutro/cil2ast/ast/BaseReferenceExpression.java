package io.github.eutro.cil2ast.ast;

/**
 * {@code base}, the receiver of a non-virtual call into a base type.
 */
public final class BaseReferenceExpression extends Expression {
    public static final BaseReferenceExpression INSTANCE = new BaseReferenceExpression();

    private BaseReferenceExpression() {
    }

    @Override
    public Kind getKind() {
        return Kind.BASE_REFERENCE;
    }
}
