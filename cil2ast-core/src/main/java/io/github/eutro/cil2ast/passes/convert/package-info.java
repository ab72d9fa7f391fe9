/**
 * Passes that convert between representations: instructions to graphs.
 */
package io.github.eutro.cil2ast.passes.convert;
