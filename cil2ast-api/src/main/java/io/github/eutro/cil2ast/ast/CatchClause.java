package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * {@code catch (Type name) { body }}. Both the type and the name are optional.
 */
public final class CatchClause {
    @Nullable
    private final TypeRef type;
    @Nullable
    private final String variableName;
    private final BlockStatement body;

    public CatchClause(@Nullable TypeRef type, @Nullable String variableName, BlockStatement body) {
        this.type = type;
        this.variableName = variableName;
        this.body = body;
    }

    public @Nullable TypeRef getType() {
        return type;
    }

    public @Nullable String getVariableName() {
        return variableName;
    }

    public BlockStatement getBody() {
        return body;
    }

    public CatchClause withBody(BlockStatement body) {
        return body == this.body ? this : new CatchClause(type, variableName, body);
    }
}
