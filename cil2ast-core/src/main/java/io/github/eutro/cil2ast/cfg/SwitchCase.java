package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.ast.CaseLabel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A case of a {@link SwitchConstruct}: the labels that dispatch to one target block.
 */
public final class SwitchCase {
    private final List<CaseLabel> labels;
    private final boolean isDefault;
    private BasicBlock target;

    /**
     * Construct a switch case.
     *
     * @param labels    The labels, in canonical order, not including {@code default}.
     * @param isDefault Whether this case also handles every value not labelled elsewhere.
     * @param target    The target block.
     */
    public SwitchCase(List<CaseLabel> labels, boolean isDefault, BasicBlock target) {
        for (CaseLabel label : labels) {
            if (label.isDefault()) throw new IllegalArgumentException("default is a marker, not a label");
        }
        if (labels.isEmpty() && !isDefault) throw new IllegalArgumentException("case without labels");
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.isDefault = isDefault;
        this.target = target;
    }

    public List<CaseLabel> getLabels() {
        return labels;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public BasicBlock getTarget() {
        return target;
    }

    void setTarget(BasicBlock target) {
        this.target = target;
    }

    /**
     * Get the labels as they appear on the section, with {@code default} last.
     *
     * @return The section labels.
     */
    public List<CaseLabel> getSectionLabels() {
        if (!isDefault) return labels;
        List<CaseLabel> all = new ArrayList<>(labels);
        all.add(CaseLabel.DEFAULT);
        return all;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (CaseLabel label : getSectionLabels()) {
            sb.append(label).append(' ');
        }
        return sb.append("-> ").append(target.getLabel()).toString();
    }
}
