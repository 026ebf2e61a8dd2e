package de.mirkosertic.contactbench.schema;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Filter operators, addressed in raw parameters by their suffix ({@code first_name__icontains}).
 */
public enum Operator {

    EXACT("exact"),
    ICONTAINS("icontains"),
    GTE("gte"),
    LTE("lte"),
    GT("gt"),
    LT("lt"),
    RANGE("range");

    /** Operators every comparable field (integer, date, timestamp) supports. */
    public static final Set<Operator> COMPARISON = Set.of(EXACT, GTE, LTE, GT, LT, RANGE);

    private final String suffix;

    Operator(final String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Returns the operator for a parameter suffix, or null if the suffix is not an operator.
     */
    public static @Nullable Operator fromSuffix(final String suffix) {
        for (final Operator operator : values()) {
            if (operator.suffix.equals(suffix)) {
                return operator;
            }
        }
        return null;
    }
}
