package io.github.eutro.cil2ast.passes;

import io.github.eutro.cil2ast.passes.misc.ChainedPass;

/**
 * One step of the decompilation pipeline.
 * <p>
 * Steps either lower a method to the next representation (instructions to graph, graph to tree)
 * or clean up a representation without changing its type. See {@link Passes} for the pipelines.
 *
 * @param <A> What the step consumes.
 * @param <B> What the step produces.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Build the pipeline that runs this step and then {@code next}.
     *
     * @param next The following step.
     * @param <C>  What the following step produces.
     * @return The pipeline.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }

    /**
     * Whether {@link #run} edits and returns its argument. A pipeline made only of such steps
     * is itself one.
     *
     * @return True for in-place steps.
     */
    default boolean isInPlace() {
        return false;
    }
}
