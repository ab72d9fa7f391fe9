package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;

/**
 * A local function. The core never synthesises these, but they may be spliced in by later layers,
 * and block flattening must respect the scope they declare.
 */
public final class LocalFunctionDeclarationStatement extends Statement {
    private final TypeRef returnType;
    private final String name;
    private final BlockStatement body;

    public LocalFunctionDeclarationStatement(TypeRef returnType, String name, BlockStatement body) {
        this.returnType = returnType;
        this.name = name;
        this.body = body;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public String getName() {
        return name;
    }

    public BlockStatement getBody() {
        return body;
    }

    public LocalFunctionDeclarationStatement withBody(BlockStatement body) {
        return body == this.body ? this : new LocalFunctionDeclarationStatement(returnType, name, body);
    }

    @Override
    public Kind getKind() {
        return Kind.LOCAL_FUNCTION_DECLARATION;
    }
}
