package io.github.eutro.cil2ast.ext;

/**
 * A typed key for side data hung off graph nodes and syntax trees.
 * <p>
 * Keys compare by identity, so two keys with the same name are still distinct.
 * Values attached under a key are checked against its class when they are attached.
 *
 * @param <T> The type of value stored under this key.
 */
public final class Ext<T> {
    private final Class<? super T> type;
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a key.
     * <p>
     * {@code type} may be the raw class of a generic value type, such as {@code List.class}
     * for a key holding a {@code List<BasicBlock>}.
     *
     * @param type The class every value must be an instance of.
     * @param name A name shown when the key is printed.
     * @param <C>  The class type.
     * @param <T>  The value type.
     * @return The key.
     */
    public static <C, T extends C> Ext<T> create(Class<C> type, String name) {
        return new Ext<>(type, name);
    }

    public Class<? super T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    T check(T value) {
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException(name + " expects " + type.getName() + ", got " + value.getClass().getName());
        }
        return value;
    }

    @Override
    public String toString() {
        return name + " (" + type.getSimpleName() + ")";
    }
}
