/**
 * The ext API, for attaching typed metadata to objects.
 * <p>
 * An {@link io.github.eutro.cil2ast.ext.Ext Ext} is a typed key, and an
 * {@link io.github.eutro.cil2ast.ext.ExtContainer ExtContainer} maps exts to values.
 * Control flow graphs and their blocks are ext containers themselves, whereas
 * immutable statement trees keep theirs in a side table,
 * {@link io.github.eutro.cil2ast.ast.Annotations Annotations}.
 */
package io.github.eutro.cil2ast.ext;
