package io.github.eutro.cil2ast.ast;

public final class ThisReferenceExpression extends Expression {
    public static final ThisReferenceExpression INSTANCE = new ThisReferenceExpression();

    private ThisReferenceExpression() {
    }

    @Override
    public Kind getKind() {
        return Kind.THIS_REFERENCE;
    }
}
