/**
 * The collaborator interfaces of the decompiler core, the CIL instruction model it consumes,
 * and its settings and error taxonomy.
 */
package io.github.eutro.cil2ast.api;
