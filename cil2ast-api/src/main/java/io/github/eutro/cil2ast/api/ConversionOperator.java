package io.github.eutro.cil2ast.api;

/**
 * A user-defined conversion operator ({@code op_Implicit} or {@code op_Explicit}).
 */
public final class ConversionOperator {
    /**
     * Whether the conversion is declared implicit or explicit.
     */
    public enum Kind {
        IMPLICIT("op_Implicit"),
        EXPLICIT("op_Explicit");

        private final String metadataName;

        Kind(String metadataName) {
            this.metadataName = metadataName;
        }

        public String getMetadataName() {
            return metadataName;
        }
    }

    private final Kind kind;
    private final Symbol method;

    public ConversionOperator(Kind kind, Symbol method) {
        if (method.getKind() != Symbol.Kind.METHOD || method.getParameterTypes().size() != 1) {
            throw new IllegalArgumentException("not a unary operator method: " + method);
        }
        this.kind = kind;
        this.method = method;
    }

    public Kind getKind() {
        return kind;
    }

    public Symbol getMethod() {
        return method;
    }

    public TypeRef getSourceType() {
        return method.getParameterTypes().get(0);
    }

    public TypeRef getTargetType() {
        return method.getType();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " operator " + getTargetType() + "(" + getSourceType() + ")";
    }
}
