package io.creditx.core.rule;

import java.util.Locale;

/// Comparison applied by a {@link ThresholdRule} between a feature value and its threshold.
public enum ComparisonOperator {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /// Returns the operator symbol used in logs and documentation.
    public String symbol() {
        return symbol;
    }

    /// Applies the comparison `value <op> threshold`.
    ///
    /// @param value feature value
    /// @param threshold configured threshold
    /// @return true if the comparison holds
    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case GTE -> value >= threshold;
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case EQ -> value == threshold;
        };
    }

    /// Resolves an operator from its name (`"GTE"`) or symbol (`">="`).
    ///
    /// @param value name or symbol, not null
    /// @return matching operator, never null
    /// @throws IllegalArgumentException if nothing matches
    public static ComparisonOperator parse(String value) {
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
