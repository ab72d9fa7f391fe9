package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies a method whose body can be fetched from a {@link MetadataSource}.
 */
public final class MethodId implements Comparable<MethodId> {
    private final int token;
    private final String name;

    /**
     * Construct a method id.
     *
     * @param token The metadata token of the method definition.
     * @param name  A display name, used only for diagnostics.
     */
    public MethodId(int token, String name) {
        this.token = token;
        this.name = name;
    }

    /**
     * Get the metadata token of the method.
     *
     * @return The token.
     */
    public int getToken() {
        return token;
    }

    /**
     * Get the display name of the method.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return token == ((MethodId) o).token;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(token);
    }

    @Override
    public int compareTo(@NotNull MethodId o) {
        return Integer.compare(token, o.token);
    }

    @Override
    public String toString() {
        return String.format("%s [%08x]", name, token);
    }
}
