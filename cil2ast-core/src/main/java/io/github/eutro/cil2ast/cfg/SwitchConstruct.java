package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.Expression;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A recognised multi-way branch on one discriminant.
 */
public final class SwitchConstruct {
    /**
     * How the result of the switch is discharged.
     */
    public enum DischargeKind {
        /**
         * As a switch statement.
         */
        STATEMENT,
        /**
         * As a switch expression assigned to {@link #getAssignedVariable()}; each case target holds
         * only that assignment and jumps to {@link #getValueFollow()}.
         */
        EXPRESSION_VALUE,
    }

    private final Expression discriminant;
    private final List<SwitchCase> cases;
    private DischargeKind dischargeKind = DischargeKind.STATEMENT;
    @Nullable
    private String assignedVariable;
    @Nullable
    private BasicBlock valueFollow;

    /**
     * Construct a switch.
     *
     * @param discriminant The value switched on.
     * @param cases        The cases, in canonical order.
     * @throws IllegalArgumentException If labels repeat, or there is more than one default.
     */
    public SwitchConstruct(Expression discriminant, List<SwitchCase> cases) {
        Set<CaseLabel> seen = new HashSet<>();
        boolean seenDefault = false;
        for (SwitchCase switchCase : cases) {
            for (CaseLabel label : switchCase.getLabels()) {
                if (!seen.add(label)) throw new IllegalArgumentException("duplicate label " + label);
            }
            if (switchCase.isDefault()) {
                if (seenDefault) throw new IllegalArgumentException("more than one default");
                seenDefault = true;
            }
        }
        this.discriminant = discriminant;
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
    }

    public Expression getDiscriminant() {
        return discriminant;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    public @Nullable SwitchCase getDefaultCase() {
        for (SwitchCase switchCase : cases) {
            if (switchCase.isDefault()) return switchCase;
        }
        return null;
    }

    /**
     * Get the target blocks in case order.
     *
     * @return The targets.
     */
    public List<BasicBlock> getTargets() {
        List<BasicBlock> targets = new ArrayList<>();
        for (SwitchCase switchCase : cases) {
            targets.add(switchCase.getTarget());
        }
        return targets;
    }

    void replaceTarget(BasicBlock from, BasicBlock to) {
        for (SwitchCase switchCase : cases) {
            if (switchCase.getTarget() == from) switchCase.setTarget(to);
        }
        if (valueFollow == from) valueFollow = to;
    }

    public DischargeKind getDischargeKind() {
        return dischargeKind;
    }

    public @Nullable String getAssignedVariable() {
        return assignedVariable;
    }

    public @Nullable BasicBlock getValueFollow() {
        return valueFollow;
    }

    /**
     * Discharge this switch as a value assigned to a variable.
     *
     * @param variable The variable every case assigns.
     * @param follow   The block every case continues to.
     */
    public void dischargeAsValue(String variable, BasicBlock follow) {
        this.dischargeKind = DischargeKind.EXPRESSION_VALUE;
        this.assignedVariable = variable;
        this.valueFollow = follow;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(discriminant).append(") {");
        for (SwitchCase switchCase : cases) {
            sb.append(' ').append(switchCase).append(';');
        }
        return sb.append(" }").toString();
    }
}
