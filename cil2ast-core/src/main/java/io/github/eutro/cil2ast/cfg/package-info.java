/**
 * The control flow graph of a method, with its blocks, edges, and protected regions.
 */
package io.github.eutro.cil2ast.cfg;
