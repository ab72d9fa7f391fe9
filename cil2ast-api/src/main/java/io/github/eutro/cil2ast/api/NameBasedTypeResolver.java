package io.github.eutro.cil2ast.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link TypeResolver} that identifies known types by full name, with an explicit table of
 * conversion operators.
 * <p>
 * Instances are immutable once built.
 */
public final class NameBasedTypeResolver implements TypeResolver {
    private final Map<TypeRef, List<ConversionOperator>> conversions;

    private NameBasedTypeResolver(Map<TypeRef, List<ConversionOperator>> conversions) {
        this.conversions = conversions;
    }

    /**
     * A resolver that knows of no conversion operators.
     *
     * @return The resolver.
     */
    public static NameBasedTypeResolver empty() {
        return new NameBasedTypeResolver(Collections.emptyMap());
    }

    /**
     * Create a resolver with the given conversion operators, indexed by their declaring type.
     *
     * @param operators The operators.
     * @return The resolver.
     */
    public static NameBasedTypeResolver withConversions(List<ConversionOperator> operators) {
        Map<TypeRef, List<ConversionOperator>> map = new HashMap<>();
        for (ConversionOperator op : operators) {
            TypeRef declaring = op.getMethod().getDeclaringType();
            if (declaring == null) throw new IllegalArgumentException("operator has no declaring type: " + op);
            map.computeIfAbsent(declaring, $ -> new ArrayList<>()).add(op);
        }
        for (Map.Entry<TypeRef, List<ConversionOperator>> entry : map.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        return new NameBasedTypeResolver(map);
    }

    @Override
    public boolean isKnownType(TypeRef type, KnownType known) {
        return type.getFullName().equals(known.getFullName());
    }

    @Override
    public List<ConversionOperator> getConversionOperators(TypeRef type) {
        return conversions.getOrDefault(type, Collections.emptyList());
    }
}
