package io.github.eutro.cil2ast.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} that allocates its table on the first attachment.
 * <p>
 * Graph nodes and tree annotations extend or wrap this.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private IdentityHashMap<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (value == null) {
            removeExt(ext);
            return;
        }
        if (exts == null) exts = new IdentityHashMap<>(4);
        exts.put(ext, ext.check(value));
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts != null && exts.remove(ext) != null && exts.isEmpty()) {
            exts = null;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }

    /**
     * Attach everything held here to another container, replacing values it already has under the same keys.
     *
     * @param into The target.
     */
    @SuppressWarnings("unchecked")
    public void copyInto(ExtContainer into) {
        if (exts == null) return;
        for (Map.Entry<Ext<?>, Object> e : exts.entrySet()) {
            into.attachExt((Ext<Object>) e.getKey(), e.getValue());
        }
    }
}
