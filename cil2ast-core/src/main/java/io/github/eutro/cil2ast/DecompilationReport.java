package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The results of a batch of methods, in the order they were requested.
 */
public final class DecompilationReport {
    private final List<MethodResult> results;

    public DecompilationReport(List<MethodResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<MethodResult> getResults() {
        return results;
    }

    public List<MethodResult> getSuccesses() {
        List<MethodResult> successes = new ArrayList<>();
        for (MethodResult result : results) {
            if (result.isSuccess()) successes.add(result);
        }
        return successes;
    }

    public List<MethodResult> getFailures() {
        List<MethodResult> failures = new ArrayList<>();
        for (MethodResult result : results) {
            if (!result.isSuccess()) failures.add(result);
        }
        return failures;
    }

    /**
     * Count the failures of a kind, e.g. to see how many methods were cancelled.
     *
     * @param kind The kind.
     * @return The number of methods that failed with it.
     */
    public int countFailures(ErrorKind kind) {
        int count = 0;
        for (MethodResult result : results) {
            if (result.getFailure() != null && result.getFailure().getKind() == kind) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return results.size() + " methods, " + getFailures().size() + " failed";
    }
}
