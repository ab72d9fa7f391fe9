package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;

/**
 * An {@code out T name} argument, which declares a variable in the enclosing scope.
 */
public final class OutVarDeclarationExpression extends Expression {
    private final TypeRef type;
    private final String name;

    public OutVarDeclarationExpression(TypeRef type, String name) {
        this.type = type;
        this.name = name;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public Kind getKind() {
        return Kind.OUT_VAR_DECLARATION;
    }
}
