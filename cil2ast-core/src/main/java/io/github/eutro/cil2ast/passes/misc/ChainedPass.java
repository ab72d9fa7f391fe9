package io.github.eutro.cil2ast.passes.misc;

import io.github.eutro.cil2ast.passes.IRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two passes run back to back, the output of the first feeding the second.
 * <p>
 * Nested chains are flattened when the chain is built, so a pipeline of any length runs as one loop.
 * A pass that throws has the failing stage attached to the exception as a suppressed one,
 * which keeps the {@link io.github.eutro.cil2ast.api.ErrorKind} of a decompilation failure intact.
 *
 * @param <A> The input type.
 * @param <B> The type handed from the first pass to the second.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChainedPass.class);

    private final List<IRPass<Object, Object>> stages;
    private final boolean isInPlace;

    /**
     * Chain two passes.
     *
     * @param first  The pass run on the input.
     * @param second The pass run on the output of {@code first}.
     */
    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        List<IRPass<Object, Object>> stages = new ArrayList<>();
        flattenInto(stages, first);
        flattenInto(stages, second);
        this.stages = Collections.unmodifiableList(stages);
        isInPlace = first.isInPlace() && second.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void flattenInto(List<IRPass<Object, Object>> stages, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            stages.addAll(((ChainedPass<?, ?, ?>) pass).stages);
        } else {
            stages.add((IRPass<Object, Object>) pass);
        }
    }

    /**
     * Get the passes this chain runs, in order, with nested chains expanded.
     *
     * @return The passes.
     */
    public List<IRPass<Object, Object>> getStages() {
        return stages;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A input) {
        Object value = input;
        for (int i = 0; i < stages.size(); i++) {
            IRPass<Object, Object> stage = stages.get(i);
            LOGGER.trace("stage {}: {}", i, stageName(stage));
            try {
                value = stage.run(value);
            } catch (RuntimeException | Error e) {
                e.addSuppressed(new RuntimeException("in stage " + i + " (" + stageName(stage) + ") of " + this));
                throw e;
            }
        }
        return (C) value;
    }

    private static String stageName(IRPass<?, ?> stage) {
        return stage.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (IRPass<?, ?> stage : stages) {
            if (sb.length() != 0) sb.append(" -> ");
            sb.append(stageName(stage));
        }
        return sb.toString();
    }
}
