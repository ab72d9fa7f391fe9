/**
 * Passes that simplify a graph before it is structured.
 */
package io.github.eutro.cil2ast.passes.opts;
