/**
 * Tree-to-tree passes that make a structured method read like source code.
 * Each of them is idempotent.
 */
package io.github.eutro.cil2ast.passes.normalize;
