package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.Symbol;

import java.util.List;

public final class ObjectCreateExpression extends Expression {
    private final Symbol constructor;
    private final List<Expression> arguments;

    public ObjectCreateExpression(Symbol constructor, List<Expression> arguments) {
        this.constructor = constructor;
        this.arguments = Nodes.copy(arguments);
    }

    public Symbol getConstructor() {
        return constructor;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public ObjectCreateExpression withArguments(List<Expression> arguments) {
        if (Nodes.sameElements(arguments, this.arguments)) return this;
        return new ObjectCreateExpression(constructor, arguments);
    }

    @Override
    public Kind getKind() {
        return Kind.OBJECT_CREATE;
    }
}
