/**
 * Recognition of compiled switch statements: jump tables, comparison trees, and string hash dispatch.
 */
package io.github.eutro.cil2ast.passes.switches;
