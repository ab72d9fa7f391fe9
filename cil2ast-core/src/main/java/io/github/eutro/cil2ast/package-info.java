/**
 * Reconstructs structured statement trees from the control flow of CIL method bodies.
 * <p>
 * {@link io.github.eutro.cil2ast.Decompiler} is the entry point; the individual stages
 * are composed in {@link io.github.eutro.cil2ast.passes.Passes}.
 */
package io.github.eutro.cil2ast;
