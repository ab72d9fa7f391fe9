package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.Ext;
import io.github.eutro.cil2ast.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The single control transfer that ends a {@link BasicBlock}.
 */
public final class Control extends ExtHolder {
    /**
     * The kind of transfer. The meaning of {@link #targets} and {@link #getValue()} depends on it.
     */
    public enum Kind {
        /**
         * Go to {@code targets[0]}.
         */
        JUMP,
        /**
         * If the value is true go to {@code targets[0]}, otherwise {@code targets[1]}.
         */
        CONDITIONAL,
        /**
         * Either a jump table on the value, where {@code targets} are the table entries followed by the default,
         * or a recognised {@link SwitchConstruct}, where {@code targets} are the distinct case targets in case order.
         */
        SWITCH,
        /**
         * Return the value, if any.
         */
        RETURN,
        /**
         * Throw the value, or rethrow if there is none.
         */
        THROW,
        /**
         * Leave a protected region, going to {@code targets[0]}.
         */
        LEAVE,
        /**
         * The end of a finally or fault handler.
         */
        END_FINALLY,
        /**
         * Fall off the end of the method.
         */
        EXIT,
    }

    private final Kind kind;
    /**
     * The targets of this control. See {@link Kind} for the order.
     */
    public final List<BasicBlock> targets;
    @Nullable
    private Expression value;
    @Nullable
    private SwitchConstruct switchConstruct;
    private boolean fallthrough;

    private Control(Kind kind, @Nullable Expression value, List<BasicBlock> targets) {
        this.kind = kind;
        this.value = value;
        this.targets = new ArrayList<>(targets);
    }

    public static Control jump(BasicBlock target) {
        return new Control(Kind.JUMP, null, Collections.singletonList(target));
    }

    /**
     * A jump that is not an instruction of its own, but straight-line flow into the next block.
     *
     * @param target The next block.
     * @return The control.
     */
    public static Control fallthrough(BasicBlock target) {
        Control control = jump(target);
        control.fallthrough = true;
        return control;
    }

    public static Control conditional(Expression condition, BasicBlock ifTrue, BasicBlock ifFalse) {
        return new Control(Kind.CONDITIONAL, condition, Arrays.asList(ifTrue, ifFalse));
    }

    /**
     * A raw jump table.
     *
     * @param value       The value dispatched on.
     * @param table       The table entries, for values from zero.
     * @param defaultCase The target for values outside the table.
     * @return The control.
     */
    public static Control jumpTable(Expression value, List<BasicBlock> table, BasicBlock defaultCase) {
        List<BasicBlock> targets = new ArrayList<>(table);
        targets.add(defaultCase);
        return new Control(Kind.SWITCH, value, targets);
    }

    /**
     * A recognised switch.
     *
     * @param construct The switch.
     * @return The control.
     */
    public static Control switchOn(SwitchConstruct construct) {
        Control control = new Control(Kind.SWITCH, construct.getDiscriminant(), construct.getTargets());
        control.switchConstruct = construct;
        return control;
    }

    public static Control ret(@Nullable Expression value) {
        return new Control(Kind.RETURN, value, Collections.emptyList());
    }

    public static Control doThrow(@Nullable Expression value) {
        return new Control(Kind.THROW, value, Collections.emptyList());
    }

    public static Control leave(BasicBlock target) {
        return new Control(Kind.LEAVE, null, Collections.singletonList(target));
    }

    public static Control endFinally() {
        return new Control(Kind.END_FINALLY, null, Collections.emptyList());
    }

    public static Control exit() {
        return new Control(Kind.EXIT, null, Collections.emptyList());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the condition, switch value, return value or thrown value.
     *
     * @return The value, or null if this kind has none.
     */
    public @Nullable Expression getValue() {
        return value;
    }

    public void setValue(@Nullable Expression value) {
        this.value = value;
    }

    /**
     * Get the recognised switch, if this is one.
     *
     * @return The switch, or null if this is not a recognised switch.
     */
    public @Nullable SwitchConstruct getSwitchConstruct() {
        return switchConstruct;
    }

    public boolean isFallthrough() {
        return fallthrough;
    }

    /**
     * Whether this control ends a path through the method.
     *
     * @return Whether this has no successors.
     */
    public boolean isTerminal() {
        return targets.isEmpty();
    }

    /**
     * Redirect every edge to one block to another.
     *
     * @param from The old target.
     * @param to   The new target.
     */
    public void replaceTarget(BasicBlock from, BasicBlock to) {
        targets.replaceAll(it -> it == from ? to : it);
        if (switchConstruct != null) {
            switchConstruct.replaceTarget(from, to);
        }
    }

    /**
     * Get the edges leaving this control.
     *
     * @param source The block this control ends.
     * @return The edges.
     */
    public List<ControlFlowEdge> edges(BasicBlock source) {
        List<ControlFlowEdge> edges = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            ControlFlowEdge.Kind edgeKind;
            switch (kind) {
                case JUMP:
                    edgeKind = fallthrough ? ControlFlowEdge.Kind.FALLTHROUGH : ControlFlowEdge.Kind.JUMP;
                    break;
                case LEAVE:
                    edgeKind = ControlFlowEdge.Kind.JUMP;
                    break;
                case CONDITIONAL:
                    edgeKind = i == 0 ? ControlFlowEdge.Kind.BRANCH : ControlFlowEdge.Kind.FALLTHROUGH;
                    break;
                case SWITCH:
                    edgeKind = switchConstruct == null && i == targets.size() - 1
                            ? ControlFlowEdge.Kind.FALLTHROUGH
                            : ControlFlowEdge.Kind.BRANCH;
                    break;
                default:
                    throw new IllegalStateException(kind + " has targets");
            }
            edges.add(new ControlFlowEdge(source, targets.get(i), edgeKind));
        }
        return edges;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase());
        if (switchConstruct != null) {
            sb.append(' ').append(switchConstruct);
        } else if (value != null) {
            sb.append(' ').append(value);
        }
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.getLabel());
            }
        }
        return sb.toString();
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CfgExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CfgExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CfgExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
