package io.github.eutro.cil2ast.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An immutable set of string values, possibly including {@code null}.
 * <p>
 * The non-null strings are either a finite set, or every string except a finite set.
 * Finite sets keep the order strings were added in.
 */
public final class StringValueSet implements ValueSet<StringValueSet> {
    public static final StringValueSet EMPTY = new StringValueSet(false, Collections.emptySet(), false);
    public static final StringValueSet UNIVERSE = new StringValueSet(true, Collections.emptySet(), true);
    public static final StringValueSet NULL = new StringValueSet(false, Collections.emptySet(), true);

    private final boolean cofinite;
    private final Set<String> strings;
    private final boolean hasNull;

    private StringValueSet(boolean cofinite, Set<String> strings, boolean hasNull) {
        this.cofinite = cofinite;
        this.strings = strings;
        this.hasNull = hasNull;
    }

    public static StringValueSet of(String value) {
        return new StringValueSet(false, Collections.singleton(value), false);
    }

    /**
     * Whether every string but finitely many is in this set.
     *
     * @return Whether this set is cofinite.
     */
    public boolean isCofinite() {
        return cofinite;
    }

    public boolean containsNull() {
        return hasNull;
    }

    /**
     * Get the strings of a finite set, in insertion order.
     *
     * @return The strings.
     * @throws IllegalStateException If this set is cofinite.
     */
    public Set<String> strings() {
        if (cofinite) throw new IllegalStateException("cofinite set");
        return Collections.unmodifiableSet(strings);
    }

    public boolean contains(String value) {
        return cofinite != strings.contains(value);
    }

    /**
     * Remove or add {@code null}, keeping every string.
     *
     * @param withNull Whether the result contains {@code null}.
     * @return The set.
     */
    public StringValueSet withNull(boolean withNull) {
        if (withNull == hasNull) return this;
        return new StringValueSet(cofinite, strings, withNull);
    }

    @Override
    public boolean isEmpty() {
        return !cofinite && strings.isEmpty() && !hasNull;
    }

    @Override
    public StringValueSet invert() {
        return new StringValueSet(!cofinite, strings, !hasNull);
    }

    @Override
    public StringValueSet intersect(StringValueSet other) {
        boolean withNull = hasNull && other.hasNull;
        Set<String> result = new LinkedHashSet<>();
        if (!cofinite && !other.cofinite) {
            for (String s : strings) {
                if (other.strings.contains(s)) result.add(s);
            }
            return new StringValueSet(false, result, withNull);
        } else if (cofinite && other.cofinite) {
            result.addAll(strings);
            result.addAll(other.strings);
            return new StringValueSet(true, result, withNull);
        }
        StringValueSet finite = cofinite ? other : this;
        StringValueSet excluded = cofinite ? this : other;
        for (String s : finite.strings) {
            if (!excluded.strings.contains(s)) result.add(s);
        }
        return new StringValueSet(false, result, withNull);
    }

    @Override
    public StringValueSet except(StringValueSet other) {
        return intersect(other.invert());
    }

    @Override
    public StringValueSet union(StringValueSet other) {
        return invert().intersect(other.invert()).invert();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StringValueSet that = (StringValueSet) o;
        return cofinite == that.cofinite && hasNull == that.hasNull && strings.equals(that.strings);
    }

    @Override
    public int hashCode() {
        return (strings.hashCode() * 31 + (cofinite ? 1 : 0)) * 31 + (hasNull ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(cofinite ? "~{" : "{");
        boolean first = true;
        if (hasNull != cofinite) {
            sb.append("null");
            first = false;
        }
        for (String s : strings) {
            if (!first) sb.append(", ");
            first = false;
            sb.append('"').append(s).append('"');
        }
        return sb.append('}').toString();
    }
}
