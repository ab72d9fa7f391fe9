package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.Ext;
import io.github.eutro.cil2ast.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A maximal straight-line run of lifted statements, ended by exactly one {@link Control}.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The offset of blocks that do not correspond to any instruction.
     */
    public static final int SYNTHETIC = -1;

    private final int offset;
    private final String label;
    private final List<Statement> statements = new ArrayList<>();
    private Control control;

    BasicBlock(int offset, String label) {
        this.offset = offset;
        this.label = label;
    }

    /**
     * Get the IL offset of the first instruction of this block.
     *
     * @return The offset, or {@link #SYNTHETIC}.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Get the name of this block, unique in its graph, and used as its {@code goto} label.
     *
     * @return The label.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Get the statements of this block, which may be modified freely.
     *
     * @return The statements.
     */
    public List<Statement> getStatements() {
        return statements;
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null) this.control.removeExt(CfgExts.OWNING_BLOCK);
        control.attachExt(CfgExts.OWNING_BLOCK, this);
        this.control = control;
    }

    /**
     * Get the ordinary successors of this block.
     *
     * @return The control targets.
     */
    public List<BasicBlock> successors() {
        return control.targets;
    }

    /**
     * Get the ordinary predecessors of this block, as last computed.
     *
     * @return The predecessors.
     * @see io.github.eutro.cil2ast.ext.MetadataState#PREDS
     */
    public List<BasicBlock> predecessors() {
        return getExtOrThrow(CfgExts.PREDS);
    }

    /**
     * Check whether this block is dominated by another, using the last computed dominator tree.
     *
     * @param dominator The potential dominator.
     * @return Whether every path from the entry to this block passes through {@code dominator}.
     */
    public boolean isDominatedBy(BasicBlock dominator) {
        BasicBlock block = this;
        while (block != null) {
            if (block == dominator) return true;
            block = block.getNullable(CfgExts.IDOM);
        }
        return false;
    }

    /**
     * Whether this block is only a return or throw of a simple value, so may be duplicated
     * at each jump to it instead of being jumped to.
     *
     * @return Whether this block is a trivial exit.
     */
    public boolean isTrivialExit() {
        if (!statements.isEmpty()) return false;
        switch (control.getKind()) {
            case RETURN:
            case THROW:
                break;
            default:
                return false;
        }
        Expression value = control.getValue();
        if (value == null) return true;
        switch (value.getKind()) {
            case IDENTIFIER:
            case PRIMITIVE:
            case THIS_REFERENCE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(":\n");
        for (Statement statement : statements) {
            for (String line : statement.toString().split("\n")) {
                sb.append("    ").append(line).append('\n');
            }
        }
        sb.append("    ").append(control);
        return sb.toString();
    }

    // exts
    private ControlFlowGraph owner = null;

    public ControlFlowGraph getGraph() {
        return owner;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CfgExts.OWNING_GRAPH) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CfgExts.OWNING_GRAPH) {
            owner = (ControlFlowGraph) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CfgExts.OWNING_GRAPH) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
