package io.github.eutro.cil2ast.util;

/**
 * An immutable set of possible values of a switch discriminant.
 *
 * @param <S> The implementing type.
 */
public interface ValueSet<S extends ValueSet<S>> {
    boolean isEmpty();

    S intersect(S other);

    S except(S other);

    S union(S other);

    S invert();
}
