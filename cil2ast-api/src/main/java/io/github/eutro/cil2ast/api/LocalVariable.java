package io.github.eutro.cil2ast.api;

/**
 * A local variable declared by a method body.
 */
public final class LocalVariable {
    private final int index;
    private final String name;
    private final TypeRef type;

    public LocalVariable(int index, String name, TypeRef type) {
        this.index = index;
        this.name = name;
        this.type = type;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public String toString() {
        return type + " " + name;
    }
}
