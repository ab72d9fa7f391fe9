/**
 * The statement tree that reconstruction produces.
 * <p>
 * {@link io.github.eutro.cil2ast.ast.Statement Statement} and
 * {@link io.github.eutro.cil2ast.ast.Expression Expression} are closed hierarchies, each tagged
 * with a kind enum; code that inspects trees switches on the kind. Nodes are immutable and
 * {@link io.github.eutro.cil2ast.ast.AstRewriter rewriting} produces new trees, sharing unchanged
 * subtrees. Extra facts about nodes live in {@link io.github.eutro.cil2ast.ast.Annotations Annotations}.
 */
package io.github.eutro.cil2ast.ast;
