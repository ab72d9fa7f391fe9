package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.DecompilerContext;
import io.github.eutro.cil2ast.Diagnostic;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.Instruction;
import io.github.eutro.cil2ast.api.KnownType;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.VariableDeclarationStatement;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.Ext;
import io.github.eutro.cil2ast.ext.ExtHolder;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.ext.TrackedList;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The control flow graph of one method, encapsulating a list of {@link BasicBlock basic blocks}.
 */
public final class ControlFlowGraph extends ExtHolder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowGraph.class);

    private final MethodId methodId;
    private final Symbol method;
    private final DecompilerContext context;

    /**
     * The blocks of this graph, in IL order as far as possible. The first element is the entry block.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CfgExts.OWNING_GRAPH, ControlFlowGraph.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CfgExts.OWNING_GRAPH);
        }
    }; // [0] is entry

    private final List<ProtectedRegion> regions = new ArrayList<>();
    private final Map<String, TypeRef> locals = new LinkedHashMap<>();
    private final Map<String, Integer> localCounters = new HashMap<>();
    private final Set<String> catchVariables = new HashSet<>();
    private final List<Integer> unreachableOffsets = new ArrayList<>();
    private final Annotations annotations = new Annotations();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int syntheticBlocks = 0;

    public ControlFlowGraph(MethodId methodId, Symbol method, DecompilerContext context) {
        this.methodId = methodId;
        this.method = method;
        this.context = context;
    }

    public MethodId getMethodId() {
        return methodId;
    }

    public Symbol getMethod() {
        return method;
    }

    public DecompilerContext getContext() {
        return context;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    /**
     * Get the protected regions of this graph, innermost first.
     *
     * @return The regions.
     */
    public List<ProtectedRegion> getRegions() {
        return regions;
    }

    public Annotations getAnnotations() {
        return annotations;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Create a block for the instruction at an offset and add it to this graph.
     *
     * @param offset The IL offset.
     * @return The new block.
     */
    public BasicBlock newBlock(int offset) {
        BasicBlock block = new BasicBlock(offset, Instruction.formatOffset(offset));
        blocks.add(block);
        return block;
    }

    /**
     * Create a block that does not correspond to any instruction, and add it to this graph.
     *
     * @return The new block.
     */
    public BasicBlock newSyntheticBlock() {
        BasicBlock block = new BasicBlock(BasicBlock.SYNTHETIC, "B" + syntheticBlocks++);
        blocks.add(block);
        return block;
    }

    /**
     * Declare a named local of this method.
     *
     * @param name The name.
     * @param type The type.
     */
    public void declareLocal(String name, TypeRef type) {
        locals.put(name, type);
    }

    /**
     * Remove the declaration of a local that is no longer used.
     *
     * @param name The name.
     */
    public void removeLocal(String name) {
        locals.remove(name);
    }

    /**
     * Create a new local with a fresh name, such as {@code stack_3}.
     *
     * @param prefix The name prefix.
     * @param type   The type.
     * @return The name of the local.
     */
    public String newSyntheticLocal(String prefix, TypeRef type) {
        String name;
        do {
            int index = localCounters.merge(prefix, 1, Integer::sum) - 1;
            name = prefix + "_" + index;
        } while (locals.containsKey(name));
        locals.put(name, type);
        return name;
    }

    /**
     * Create a fresh variable for a caught exception. It is declared by its catch clause, not with the other locals.
     *
     * @param type The caught type.
     * @return The name of the variable.
     */
    public String newCatchVariable(TypeRef type) {
        String name = newSyntheticLocal("ex", type);
        catchVariables.add(name);
        return name;
    }

    /**
     * Record that a local also holds values of another type, widening it to {@code object} if they differ.
     *
     * @param name The local.
     * @param type The other type.
     */
    public void widenLocal(String name, TypeRef type) {
        TypeRef existing = locals.get(name);
        if (existing != null && !existing.equals(type)) {
            locals.put(name, TypeRef.of(KnownType.OBJECT));
        }
    }

    public @Nullable TypeRef getLocalType(String name) {
        return locals.get(name);
    }

    /**
     * Get declarations of every local of this method, in declaration order.
     *
     * @return The declarations.
     */
    public List<VariableDeclarationStatement> getDeclarations() {
        List<VariableDeclarationStatement> decls = new ArrayList<>();
        for (Map.Entry<String, TypeRef> entry : locals.entrySet()) {
            if (catchVariables.contains(entry.getKey())) continue;
            decls.add(new VariableDeclarationStatement(entry.getValue(), entry.getKey(), null));
        }
        return decls;
    }

    /**
     * Record a recovered problem.
     *
     * @param kind    The kind of problem.
     * @param offset  The IL offset, or {@link Diagnostic#NO_OFFSET}.
     * @param message The message.
     */
    public void addDiagnostic(ErrorKind kind, int offset, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, offset, message);
        LOGGER.debug("{}: {}", methodId, diagnostic);
        diagnostics.add(diagnostic);
    }

    /**
     * Check whether two blocks are in the same try and handler blocks of every protected region.
     *
     * @param a A block.
     * @param b Another block.
     * @return Whether control may pass between them without entering or leaving a region.
     */
    public boolean inSameRegions(BasicBlock a, BasicBlock b) {
        for (ProtectedRegion region : regions) {
            if (region.getTryBlocks().contains(a) != region.getTryBlocks().contains(b)) return false;
            if (region.getHandlerBlocks().contains(a) != region.getHandlerBlocks().contains(b)) return false;
        }
        return true;
    }

    /**
     * Check whether a block is the entry of a try or of a handler.
     *
     * @param block The block.
     * @return Whether it is.
     */
    public boolean isRegionEntry(BasicBlock block) {
        for (ProtectedRegion region : regions) {
            if (region.getTryEntry() == block || region.getHandlerEntry() == block) return true;
        }
        return false;
    }

    /**
     * Remove a block from this graph and from every protected region.
     *
     * @param block The block.
     */
    public void removeBlock(BasicBlock block) {
        blocks.remove(block);
        for (ProtectedRegion region : regions) {
            region.getTryBlocks().remove(block);
            region.getHandlerBlocks().remove(block);
        }
    }

    /**
     * Remove a block that no structured code can reach, recording it so it is emitted as a stub.
     *
     * @param block The block.
     */
    public void markUnreachable(BasicBlock block) {
        removeBlock(block);
        if (block.getOffset() != BasicBlock.SYNTHETIC) {
            unreachableOffsets.add(block.getOffset());
            addDiagnostic(ErrorKind.UNREACHABLE_BLOCK, block.getOffset(), "unreachable block " + block.getLabel());
        }
    }

    /**
     * Get the offsets of blocks removed by {@link #markUnreachable(BasicBlock)}.
     *
     * @return The offsets.
     */
    public List<Integer> getUnreachableOffsets() {
        return unreachableOffsets;
    }

    /**
     * Get every edge of this graph, including edges from protected blocks to their handlers.
     *
     * @return The edges.
     */
    public List<ControlFlowEdge> getEdges() {
        List<ControlFlowEdge> edges = new ArrayList<>();
        for (BasicBlock block : blocks) {
            edges.addAll(block.getControl().edges(block));
        }
        for (ProtectedRegion region : regions) {
            for (BasicBlock tryBlock : region.getTryBlocks()) {
                edges.add(new ControlFlowEdge(tryBlock, region.getHandlerEntry(), ControlFlowEdge.Kind.EXCEPTION_HANDLER));
            }
        }
        return edges;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(methodId).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CfgExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CfgExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CfgExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
