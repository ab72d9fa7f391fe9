package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.ext.Ext;
import io.github.eutro.cil2ast.ext.ExtContainer;
import io.github.eutro.cil2ast.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A side table of data about tree nodes, keyed by node identity.
 * <p>
 * Nodes are immutable and shared between trees, so nothing is stored on them directly.
 * A table belongs to the decompilation of one method, and is not thread-safe.
 */
public final class Annotations {
    /**
     * The user-defined operator method that an operator expression calls.
     */
    public static final Ext<Symbol> USER_DEFINED_OPERATOR = Ext.create(Symbol.class, "USER_DEFINED_OPERATOR");
    /**
     * The IL offset a statement was lifted from.
     */
    public static final Ext<Integer> IL_OFFSET = Ext.create(Integer.class, "IL_OFFSET");

    private final Map<Object, ExtHolder> table = new IdentityHashMap<>();

    /**
     * Get the annotations of a node, creating an empty set if there are none.
     *
     * @param node The node.
     * @return The container of its annotations.
     */
    public ExtContainer of(Object node) {
        return table.computeIfAbsent(node, $ -> new ExtHolder());
    }

    public <T> @Nullable T get(Object node, Ext<T> ext) {
        ExtHolder holder = table.get(node);
        return holder == null ? null : holder.getNullable(ext);
    }

    public <T> void put(Object node, Ext<T> ext, T value) {
        of(node).attachExt(ext, value);
    }

    public boolean has(Object node, Ext<?> ext) {
        return get(node, ext) != null;
    }

    /**
     * Copy the annotations of one node onto another, which replaces it in a rebuilt tree.
     *
     * @param from The old node.
     * @param to   The new node.
     */
    public void copy(Object from, Object to) {
        if (from == to) return;
        ExtHolder holder = table.get(from);
        if (holder != null) holder.copyInto(of(to));
    }

    /**
     * Whether an operator expression is a call to a user-defined operator.
     *
     * @param expr The expression.
     * @return Whether it is marked as user-defined.
     */
    public boolean isUserDefinedOperator(Expression expr) {
        return has(expr, USER_DEFINED_OPERATOR);
    }
}
