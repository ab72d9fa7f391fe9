package io.github.eutro.cil2ast.api;

/**
 * Flags that toggle individual transforms. Each flag affects exactly one transform.
 * <p>
 * Settings are immutable; use {@link #builder()} to create them.
 */
public final class DecompilerSettings {
    /**
     * The default settings.
     */
    public static final DecompilerSettings DEFAULT = builder().build();

    private final boolean alwaysUseBraces;
    private final boolean switchStatementOnString;
    private final boolean sparseIntegerSwitch;
    private final boolean introduceIncrementAndDecrement;
    private final boolean switchExpressions;
    private final boolean stringConcat;

    private DecompilerSettings(Builder builder) {
        alwaysUseBraces = builder.alwaysUseBraces;
        switchStatementOnString = builder.switchStatementOnString;
        sparseIntegerSwitch = builder.sparseIntegerSwitch;
        introduceIncrementAndDecrement = builder.introduceIncrementAndDecrement;
        switchExpressions = builder.switchExpressions;
        stringConcat = builder.stringConcat;
    }

    /**
     * Create a builder, with every flag set to its default.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder initialised from these settings.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setAlwaysUseBraces(alwaysUseBraces)
                .setSwitchStatementOnString(switchStatementOnString)
                .setSparseIntegerSwitch(sparseIntegerSwitch)
                .setIntroduceIncrementAndDecrement(introduceIncrementAndDecrement)
                .setSwitchExpressions(switchExpressions)
                .setStringConcat(stringConcat);
    }

    /**
     * Whether every embedded statement gets braces, except {@code else if}.
     *
     * @return The flag.
     */
    public boolean isAlwaysUseBraces() {
        return alwaysUseBraces;
    }

    /**
     * Whether string comparison chains and hash dispatches become switches on the string.
     *
     * @return The flag.
     */
    public boolean isSwitchStatementOnString() {
        return switchStatementOnString;
    }

    /**
     * Whether comparison trees without a jump table may become switches.
     *
     * @return The flag.
     */
    public boolean isSparseIntegerSwitch() {
        return sparseIntegerSwitch;
    }

    /**
     * Whether {@code x += 1} becomes {@code x++}.
     *
     * @return The flag.
     */
    public boolean isIntroduceIncrementAndDecrement() {
        return introduceIncrementAndDecrement;
    }

    /**
     * Whether switches that only assign one variable become switch expressions.
     *
     * @return The flag.
     */
    public boolean isSwitchExpressions() {
        return switchExpressions;
    }

    /**
     * Whether {@code string.Concat} calls become {@code +}.
     *
     * @return The flag.
     */
    public boolean isStringConcat() {
        return stringConcat;
    }

    @Override
    public String toString() {
        return "DecompilerSettings{" +
                "alwaysUseBraces=" + alwaysUseBraces +
                ", switchStatementOnString=" + switchStatementOnString +
                ", sparseIntegerSwitch=" + sparseIntegerSwitch +
                ", introduceIncrementAndDecrement=" + introduceIncrementAndDecrement +
                ", switchExpressions=" + switchExpressions +
                ", stringConcat=" + stringConcat +
                '}';
    }

    /**
     * A builder for {@link DecompilerSettings}.
     */
    public static class Builder {
        private boolean alwaysUseBraces = false;
        private boolean switchStatementOnString = true;
        private boolean sparseIntegerSwitch = true;
        private boolean introduceIncrementAndDecrement = true;
        private boolean switchExpressions = true;
        private boolean stringConcat = true;

        public Builder setAlwaysUseBraces(boolean alwaysUseBraces) {
            this.alwaysUseBraces = alwaysUseBraces;
            return this;
        }

        public Builder setSwitchStatementOnString(boolean switchStatementOnString) {
            this.switchStatementOnString = switchStatementOnString;
            return this;
        }

        public Builder setSparseIntegerSwitch(boolean sparseIntegerSwitch) {
            this.sparseIntegerSwitch = sparseIntegerSwitch;
            return this;
        }

        public Builder setIntroduceIncrementAndDecrement(boolean introduceIncrementAndDecrement) {
            this.introduceIncrementAndDecrement = introduceIncrementAndDecrement;
            return this;
        }

        public Builder setSwitchExpressions(boolean switchExpressions) {
            this.switchExpressions = switchExpressions;
            return this;
        }

        public Builder setStringConcat(boolean stringConcat) {
            this.stringConcat = stringConcat;
            return this;
        }

        public DecompilerSettings build() {
            return new DecompilerSettings(this);
        }
    }
}
