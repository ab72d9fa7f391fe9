package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A resolved metadata token: a method, field or type.
 */
public final class Symbol {
    /**
     * The kind of symbol.
     */
    public enum Kind {
        METHOD,
        FIELD,
        TYPE,
    }

    private final Kind kind;
    private final int token;
    private final String name;
    @Nullable
    private final TypeRef declaringType;
    private final TypeRef type;
    private final List<TypeRef> parameterTypes;
    private final List<String> parameterNames;
    private final boolean isStatic;

    private Symbol(Kind kind,
                   int token,
                   String name,
                   @Nullable TypeRef declaringType,
                   TypeRef type,
                   List<TypeRef> parameterTypes,
                   List<String> parameterNames,
                   boolean isStatic) {
        if (parameterNames.size() != parameterTypes.size()) {
            throw new IllegalArgumentException("parameter names and types differ in length");
        }
        this.kind = kind;
        this.token = token;
        this.name = name;
        this.declaringType = declaringType;
        this.type = type;
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        this.parameterNames = Collections.unmodifiableList(new ArrayList<>(parameterNames));
        this.isStatic = isStatic;
    }

    /**
     * Create a method symbol.
     *
     * @param token          The metadata token.
     * @param declaringType  The declaring type.
     * @param name           The method name.
     * @param returnType     The return type.
     * @param parameterTypes The parameter types, not including {@code this}.
     * @param parameterNames The parameter names.
     * @param isStatic       Whether the method is static.
     * @return The symbol.
     */
    public static Symbol method(int token,
                                TypeRef declaringType,
                                String name,
                                TypeRef returnType,
                                List<TypeRef> parameterTypes,
                                List<String> parameterNames,
                                boolean isStatic) {
        return new Symbol(Kind.METHOD, token, name, declaringType, returnType,
                parameterTypes, parameterNames, isStatic);
    }

    /**
     * Create a field symbol.
     *
     * @param token         The metadata token.
     * @param declaringType The declaring type.
     * @param name          The field name.
     * @param type          The field type.
     * @param isStatic      Whether the field is static.
     * @return The symbol.
     */
    public static Symbol field(int token, TypeRef declaringType, String name, TypeRef type, boolean isStatic) {
        return new Symbol(Kind.FIELD, token, name, declaringType, type,
                Collections.emptyList(), Collections.emptyList(), isStatic);
    }

    /**
     * Create a type symbol.
     *
     * @param token The metadata token.
     * @param type  The type.
     * @return The symbol.
     */
    public static Symbol type(int token, TypeRef type) {
        return new Symbol(Kind.TYPE, token, type.getName(), null, type,
                Collections.emptyList(), Collections.emptyList(), true);
    }

    public Kind getKind() {
        return kind;
    }

    public int getToken() {
        return token;
    }

    public String getName() {
        return name;
    }

    public @Nullable TypeRef getDeclaringType() {
        return declaringType;
    }

    /**
     * Get the type of the symbol: the return type of a method, the type of a field,
     * or the type itself.
     *
     * @return The type.
     */
    public TypeRef getType() {
        return type;
    }

    public List<TypeRef> getParameterTypes() {
        return parameterTypes;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    public boolean isStatic() {
        return isStatic;
    }

    /**
     * Whether this is a constructor.
     *
     * @return Whether this is a method named {@code .ctor}.
     */
    public boolean isConstructor() {
        return kind == Kind.METHOD && ".ctor".equals(name);
    }

    /**
     * Whether calling this method yields no value.
     *
     * @return Whether this is a method returning void.
     */
    public boolean returnsVoid() {
        return kind == Kind.METHOD && type.equals(TypeRef.VOID);
    }

    /**
     * Get the full name, e.g. {@code System.String.Concat}.
     *
     * @return The full name.
     */
    public String getFullName() {
        return declaringType == null ? type.getFullName() : declaringType.getFullName() + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return token == symbol.token && kind == symbol.kind && name.equals(symbol.name);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(token) + name.hashCode();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + getFullName();
    }
}
