package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;
import org.jetbrains.annotations.Nullable;

public final class VariableDeclarationStatement extends Statement {
    private final TypeRef type;
    private final String name;
    @Nullable
    private final Expression initializer;

    public VariableDeclarationStatement(TypeRef type, String name, @Nullable Expression initializer) {
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public @Nullable Expression getInitializer() {
        return initializer;
    }

    public VariableDeclarationStatement withInitializer(@Nullable Expression initializer) {
        return initializer == this.initializer ? this : new VariableDeclarationStatement(type, name, initializer);
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE_DECLARATION;
    }
}
