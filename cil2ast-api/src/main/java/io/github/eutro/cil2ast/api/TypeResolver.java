package io.github.eutro.cil2ast.api;

import java.util.List;

/**
 * An oracle for type facts.
 * <p>
 * Implementations are shared between concurrently decompiled methods, and must be safe for concurrent reads.
 */
public interface TypeResolver {
    /**
     * Check whether a type is a given known type.
     *
     * @param type  The type.
     * @param known The known type.
     * @return Whether they are the same type.
     */
    boolean isKnownType(TypeRef type, KnownType known);

    /**
     * Get the user-defined conversion operators declared by a type.
     *
     * @param type The type.
     * @return The operators, possibly empty.
     */
    List<ConversionOperator> getConversionOperators(TypeRef type);
}
