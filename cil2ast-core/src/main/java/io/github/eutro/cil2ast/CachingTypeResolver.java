package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.ConversionOperator;
import io.github.eutro.cil2ast.api.KnownType;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.api.TypeResolver;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link TypeResolver} that remembers the conversion operators of each type it is asked about.
 * <p>
 * The cache is a concurrent map, so one instance can serve every method of a parallel decompilation.
 */
public final class CachingTypeResolver implements TypeResolver {
    private final TypeResolver delegate;
    private final ConcurrentMap<TypeRef, List<ConversionOperator>> conversions = new ConcurrentHashMap<>();

    public CachingTypeResolver(TypeResolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isKnownType(TypeRef type, KnownType known) {
        return delegate.isKnownType(type, known);
    }

    @Override
    public List<ConversionOperator> getConversionOperators(TypeRef type) {
        return conversions.computeIfAbsent(type, delegate::getConversionOperators);
    }
}
