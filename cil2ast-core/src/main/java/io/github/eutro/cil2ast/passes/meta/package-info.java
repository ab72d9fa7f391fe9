/**
 * Passes that compute metadata about a graph without changing its meaning.
 *
 * @see io.github.eutro.cil2ast.ext.MetadataState
 */
package io.github.eutro.cil2ast.passes.meta;
