package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.InstructionStream;
import io.github.eutro.cil2ast.api.MetadataSource;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.NameBasedTypeResolver;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An in-memory assembly for tests.
 */
public final class TestMetadata implements MetadataSource {
    public static final TypeRef PROGRAM = TypeRef.of("Tests.Program");

    private final Map<Integer, Symbol> symbols = new ConcurrentHashMap<>();
    private final Map<MethodId, Symbol> methods = new ConcurrentHashMap<>();
    private final Map<MethodId, InstructionStream> bodies = new ConcurrentHashMap<>();
    private final Map<MethodId, List<ExceptionRegion>> regions = new ConcurrentHashMap<>();
    private int nextMethodToken = 0x06000001;
    private NameBasedTypeResolver resolver = NameBasedTypeResolver.empty();

    public TestMetadata resolver(NameBasedTypeResolver resolver) {
        this.resolver = resolver;
        return this;
    }

    public TestMetadata symbol(Symbol symbol) {
        symbols.put(symbol.getToken(), symbol);
        return this;
    }

    /**
     * Define a static method of {@link #PROGRAM}. Parameters alternate between names and types.
     */
    public MethodId define(String name, TypeRef returnType, IlBuilder body, Object... parameters) {
        return define(true, name, returnType, body, parameters);
    }

    /**
     * Define an instance method of {@link #PROGRAM}; argument 0 is {@code this}.
     */
    public MethodId defineInstance(String name, TypeRef returnType, IlBuilder body, Object... parameters) {
        return define(false, name, returnType, body, parameters);
    }

    private MethodId define(boolean isStatic, String name, TypeRef returnType, IlBuilder body, Object... parameters) {
        List<String> names = new ArrayList<>();
        List<TypeRef> types = new ArrayList<>();
        for (int i = 0; i < parameters.length; i += 2) {
            names.add((String) parameters[i]);
            types.add((TypeRef) parameters[i + 1]);
        }
        MethodId id;
        synchronized (this) {
            id = new MethodId(nextMethodToken++, name);
        }
        methods.put(id, Symbol.method(id.getToken(), PROGRAM, name, returnType, types, names, isStatic));
        bodies.put(id, body.build());
        regions.put(id, body.regions());
        return id;
    }

    public static Symbol staticMethod(int token, TypeRef declaringType, String name, TypeRef returnType, TypeRef... parameterTypes) {
        return method(token, declaringType, name, returnType, true, parameterTypes);
    }

    public static Symbol instanceMethod(int token, TypeRef declaringType, String name, TypeRef returnType, TypeRef... parameterTypes) {
        return method(token, declaringType, name, returnType, false, parameterTypes);
    }

    private static Symbol method(int token, TypeRef declaringType, String name, TypeRef returnType,
                                 boolean isStatic, TypeRef... parameterTypes) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < parameterTypes.length; i++) {
            names.add("arg" + i);
        }
        return Symbol.method(token, declaringType, name, returnType, Arrays.asList(parameterTypes), names, isStatic);
    }

    public DecompilerContext context(DecompilerSettings settings) {
        return new DecompilerContext(this, resolver, settings);
    }

    public MethodResult decompile(MethodId method) {
        return decompile(method, DecompilerSettings.DEFAULT);
    }

    public MethodResult decompile(MethodId method, DecompilerSettings settings) {
        return new Decompiler(context(settings)).decompile(method);
    }

    @Override
    public Symbol getMethod(MethodId method) {
        return lookup(methods, method);
    }

    @Override
    public InstructionStream getMethodBody(MethodId method) {
        return lookup(bodies, method);
    }

    @Override
    public List<ExceptionRegion> getExceptionRegions(MethodId method) {
        return lookup(regions, method);
    }

    @Override
    public Symbol resolveSymbol(int token) {
        Symbol symbol = symbols.get(token);
        if (symbol == null) {
            throw new DecompilationException(ErrorKind.INVALID_CONTROL_FLOW, "unknown token " + Integer.toHexString(token));
        }
        return symbol;
    }

    private static <T> T lookup(Map<MethodId, T> map, MethodId method) {
        T value = map.get(method);
        if (value == null) throw new IllegalArgumentException("no such method " + method);
        return value;
    }
}
