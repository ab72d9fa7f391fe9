package io.github.eutro.cil2ast.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something side data can be attached to with {@link Ext} keys.
 */
public interface ExtContainer {
    <T> void attachExt(Ext<T> ext, T value);

    <T> void removeExt(Ext<T> ext);

    /**
     * Look up the value under a key.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value, or null if nothing is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Look up a value that an earlier pass must have attached.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value.
     * @throws IllegalStateException If nothing is attached, which means a pass ran out of order.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(ext + " missing on " + this);
        }
        return value;
    }
}
