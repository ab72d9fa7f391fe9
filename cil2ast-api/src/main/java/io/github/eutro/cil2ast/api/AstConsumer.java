package io.github.eutro.cil2ast.api;

import io.github.eutro.cil2ast.ast.BlockStatement;

/**
 * Receives finished statement trees, e.g. a pretty-printer.
 */
public interface AstConsumer {
    /**
     * Accept the reconstructed body of a method.
     *
     * @param method The method.
     * @param body   The body.
     */
    void emit(MethodId method, BlockStatement body);
}
