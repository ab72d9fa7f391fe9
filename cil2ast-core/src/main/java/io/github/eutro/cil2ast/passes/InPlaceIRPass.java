package io.github.eutro.cil2ast.passes;

/**
 * A pass that edits a graph or tree directly and hands back the same object.
 * <p>
 * Graph passes record their edits in the graph's {@link io.github.eutro.cil2ast.ext.MetadataState},
 * tree passes swap in a rewritten body with {@link io.github.eutro.cil2ast.MethodTree#setBody}.
 *
 * @param <T> The type edited.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Edit the value.
     *
     * @param t The graph or tree.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
