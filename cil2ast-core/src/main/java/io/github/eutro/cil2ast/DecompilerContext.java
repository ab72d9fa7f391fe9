package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.MetadataSource;
import io.github.eutro.cil2ast.api.TypeResolver;

/**
 * Everything a decompilation needs from outside: metadata, type facts and settings.
 * <p>
 * A context is shared by every method decompiled with it, and is safe to share between threads
 * as long as its collaborators are.
 */
public final class DecompilerContext {
    private final MetadataSource metadata;
    private final TypeResolver typeResolver;
    private final DecompilerSettings settings;

    /**
     * Construct a context. The type resolver is wrapped in a cache unless it already is one.
     *
     * @param metadata     The metadata source.
     * @param typeResolver The type resolver.
     * @param settings     The settings.
     */
    public DecompilerContext(MetadataSource metadata, TypeResolver typeResolver, DecompilerSettings settings) {
        this.metadata = metadata;
        this.typeResolver = typeResolver instanceof CachingTypeResolver
                ? typeResolver
                : new CachingTypeResolver(typeResolver);
        this.settings = settings;
    }

    public MetadataSource getMetadata() {
        return metadata;
    }

    public TypeResolver getTypeResolver() {
        return typeResolver;
    }

    public DecompilerSettings getSettings() {
        return settings;
    }
}
