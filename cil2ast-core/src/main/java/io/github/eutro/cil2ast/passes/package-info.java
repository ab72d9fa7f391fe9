/**
 * The pass framework, and the pre-composed decompilation stages.
 */
package io.github.eutro.cil2ast.passes;
