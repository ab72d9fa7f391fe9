package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;

/**
 * A type used as an expression, e.g. the target of a static call.
 */
public final class TypeReferenceExpression extends Expression {
    private final TypeRef type;

    public TypeReferenceExpression(TypeRef type) {
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public Kind getKind() {
        return Kind.TYPE_REFERENCE;
    }
}
