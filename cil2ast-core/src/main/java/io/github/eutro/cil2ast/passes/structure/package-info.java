/**
 * Passes that turn a control flow graph into nested loops, conditionals, switches and
 * try statements, and tidy up the jumps that remain.
 */
package io.github.eutro.cil2ast.passes.structure;
