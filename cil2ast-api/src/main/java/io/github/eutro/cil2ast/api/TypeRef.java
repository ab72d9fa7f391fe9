package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A reference to a type by its full metadata name, with any generic arguments.
 * <p>
 * This is only a name; facts about the type are asked of a {@link TypeResolver}.
 */
public final class TypeRef {
    public static final TypeRef VOID = of(KnownType.VOID);
    public static final TypeRef BOOLEAN = of(KnownType.BOOLEAN);
    public static final TypeRef INT32 = of(KnownType.INT32);
    public static final TypeRef INT64 = of(KnownType.INT64);
    public static final TypeRef DOUBLE = of(KnownType.DOUBLE);
    public static final TypeRef STRING = of(KnownType.STRING);
    public static final TypeRef OBJECT = of(KnownType.OBJECT);

    private final String fullName;
    private final List<TypeRef> typeArguments;

    private TypeRef(String fullName, List<TypeRef> typeArguments) {
        this.fullName = fullName;
        this.typeArguments = typeArguments;
    }

    /**
     * Get a type reference by name.
     *
     * @param fullName      The full name, e.g. {@code System.Int32}.
     * @param typeArguments The generic arguments, if any.
     * @return The type reference.
     */
    public static TypeRef of(String fullName, TypeRef... typeArguments) {
        return new TypeRef(fullName, typeArguments.length == 0
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(typeArguments))));
    }

    /**
     * Get a reference to a known type.
     *
     * @param type The known type.
     * @return The type reference.
     */
    public static TypeRef of(KnownType type) {
        return of(type.getFullName());
    }

    /**
     * Get a reference to {@code System.Nullable<T>}.
     *
     * @param underlying The underlying value type.
     * @return The nullable type reference.
     */
    public static TypeRef nullable(TypeRef underlying) {
        return of(KnownType.NULLABLE.getFullName(), underlying);
    }

    public String getFullName() {
        return fullName;
    }

    /**
     * Get the simple name of the type, without namespace or generic arity.
     *
     * @return The simple name.
     */
    public String getName() {
        String name = fullName.substring(fullName.lastIndexOf('.') + 1);
        int tick = name.indexOf('`');
        return tick < 0 ? name : name.substring(0, tick);
    }

    public List<TypeRef> getTypeArguments() {
        return typeArguments;
    }

    /**
     * Whether this is {@code System.Nullable<T>}.
     *
     * @return Whether this is a nullable value type.
     */
    public boolean isNullable() {
        return fullName.equals(KnownType.NULLABLE.getFullName()) && typeArguments.size() == 1;
    }

    /**
     * Get the underlying type of a nullable value type.
     *
     * @return The underlying type, or null if this is not nullable.
     */
    public @Nullable TypeRef getNullableUnderlyingType() {
        return isNullable() ? typeArguments.get(0) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeRef typeRef = (TypeRef) o;
        return fullName.equals(typeRef.fullName) && typeArguments.equals(typeRef.typeArguments);
    }

    @Override
    public int hashCode() {
        return 31 * fullName.hashCode() + typeArguments.hashCode();
    }

    @Override
    public String toString() {
        KnownType known = KnownType.byFullName(fullName);
        if (known != null && known.getKeyword() != null) {
            return known.getKeyword();
        }
        if (isNullable()) {
            return typeArguments.get(0) + "?";
        }
        if (typeArguments.isEmpty()) {
            return getName();
        }
        StringBuilder sb = new StringBuilder(getName()).append('<');
        for (int i = 0; i < typeArguments.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(typeArguments.get(i));
        }
        return sb.append('>').toString();
    }
}
