package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A label of a switch section: an integer or string constant, {@code null}, or {@code default}.
 */
public final class CaseLabel {
    /**
     * The kind of a label.
     */
    public enum Kind {
        INTEGER,
        STRING,
        NULL,
        DEFAULT,
    }

    public static final CaseLabel NULL = new CaseLabel(Kind.NULL, null);
    public static final CaseLabel DEFAULT = new CaseLabel(Kind.DEFAULT, null);

    private final Kind kind;
    @Nullable
    private final Object value;

    private CaseLabel(Kind kind, @Nullable Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CaseLabel of(long value) {
        return new CaseLabel(Kind.INTEGER, value);
    }

    public static CaseLabel of(String value) {
        return new CaseLabel(Kind.STRING, value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDefault() {
        return kind == Kind.DEFAULT;
    }

    /**
     * Get the value of an integer label.
     *
     * @return The value.
     * @throws IllegalStateException If this is not an integer label.
     */
    public long getIntegerValue() {
        if (kind != Kind.INTEGER) throw new IllegalStateException("not an integer label: " + this);
        //noinspection ConstantConditions
        return (Long) value;
    }

    /**
     * Get the value of a string label.
     *
     * @return The value.
     * @throws IllegalStateException If this is not a string label.
     */
    public String getStringValue() {
        if (kind != Kind.STRING) throw new IllegalStateException("not a string label: " + this);
        //noinspection ConstantConditions
        return (String) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CaseLabel caseLabel = (CaseLabel) o;
        return kind == caseLabel.kind && (value == null ? caseLabel.value == null : value.equals(caseLabel.value));
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + (value == null ? 0 : value.hashCode());
    }

    /**
     * Render the label as it follows {@code case} or {@code goto case}.
     *
     * @return The rendering, e.g. {@code 4}, {@code "a"} or {@code null}.
     */
    public String valueString() {
        switch (kind) {
            case INTEGER:
                return String.valueOf(value);
            case STRING:
                return AstPrinter.quote((String) value);
            case NULL:
                return "null";
            case DEFAULT:
                return "default";
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public String toString() {
        return kind == Kind.DEFAULT ? "default:" : "case " + valueString() + ":";
    }
}
