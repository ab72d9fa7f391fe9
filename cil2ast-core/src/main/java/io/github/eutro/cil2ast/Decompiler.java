package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.AstConsumer;
import io.github.eutro.cil2ast.api.CancellationToken;
import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.passes.Passes;
import io.github.eutro.cil2ast.util.GraphDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reconstructs the statement trees of methods.
 * <p>
 * A decompiler holds no mutable state of its own, so one instance may decompile many methods at once.
 */
public class Decompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Decompiler.class);

    private final DecompilerContext context;

    public Decompiler(DecompilerContext context) {
        this.context = context;
    }

    public DecompilerContext getContext() {
        return context;
    }

    /**
     * Decompile a single method on the calling thread.
     * <p>
     * A method whose control flow cannot be reconstructed is not decompiled at all;
     * its result is a failure holding a placeholder body.
     *
     * @param method The method.
     * @return The result.
     */
    public MethodResult decompile(MethodId method) {
        try {
            ControlFlowGraph graph = Passes.GRAPH.run(new MethodInput(context, method));
            if (GraphDumper.DUMP_GRAPHS) {
                LOGGER.info("graph of {}:\n{}", method, GraphDumper.toDot(graph));
            }
            MethodTree tree = Passes.STRUCTURE.run(graph);
            for (Diagnostic diagnostic : tree.getDiagnostics()) {
                LOGGER.debug("{}: {}", method, diagnostic);
            }
            return MethodResult.success(method, tree.getBody(), tree.getDiagnostics());
        } catch (DecompilationException e) {
            LOGGER.warn("skipping {}: {}", method, e.getMessage());
            return MethodResult.failure(method, e);
        }
    }

    /**
     * Decompile many methods in parallel, handing each finished tree to a consumer.
     * <p>
     * Trees are handed over on the calling thread, in the order of {@code methods}. Methods not yet
     * started when {@code cancellation} is cancelled are skipped and reported as {@link ErrorKind#CANCELLED}.
     * A method that fails does not stop the others, even if it fails with an unexpected exception,
     * which is reported as {@link ErrorKind#INVALID_CONTROL_FLOW}.
     *
     * @param methods      The methods.
     * @param consumer     The consumer of finished trees, including the placeholders of failed methods.
     * @param executor     The executor to decompile on.
     * @param cancellation The cancellation token.
     * @return The report of every method.
     */
    public DecompilationReport decompileAll(Collection<MethodId> methods,
                                            AstConsumer consumer,
                                            Executor executor,
                                            CancellationToken cancellation) {
        List<CompletableFuture<MethodResult>> futures = new ArrayList<>(methods.size());
        for (MethodId method : methods) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    cancellation.throwIfCancelled();
                    return decompile(method);
                } catch (DecompilationException e) {
                    return MethodResult.failure(method, e);
                } catch (RuntimeException e) {
                    LOGGER.warn("failed to decompile {}", method, e);
                    return MethodResult.failure(method,
                            new DecompilationException(ErrorKind.INVALID_CONTROL_FLOW, e.toString(), e));
                }
            }, executor));
        }
        List<MethodResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<MethodResult> future : futures) {
            MethodResult result = future.join();
            results.add(result);
            if (result.getFailure() == null || result.getFailure().getKind() != ErrorKind.CANCELLED) {
                consumer.emit(result.getMethodId(), result.getBody());
            }
        }
        DecompilationReport report = new DecompilationReport(results);
        LOGGER.debug("decompiled {}", report);
        return report;
    }
}
