package io.creditx.core.engine;

import io.creditx.core.record.RecordKind;

/// Operations the engine performs over a batch of records.
///
/// Each operation scores one record kind with one rule set of the active weights config.
/// Score operations work in `[0, 1]` score units; pricing works in basis points.
public enum Operation {
    TRIAGE("triage_rules", RecordKind.SUBMISSION, 1.0),
    RENEWAL_PRIORITY("renewal_rules", RecordKind.POLICY, 1.0),
    PRICING("pricing_rules", RecordKind.SUBMISSION, 10_000.0);

    private final String ruleSetKey;
    private final RecordKind recordKind;
    private final double maxAbsWeight;

    Operation(String ruleSetKey, RecordKind recordKind, double maxAbsWeight) {
        this.ruleSetKey = ruleSetKey;
        this.recordKind = recordKind;
        this.maxAbsWeight = maxAbsWeight;
    }

    /// Returns the weights-file key of the rule set this operation evaluates.
    public String ruleSetKey() {
        return ruleSetKey;
    }

    /// Returns the record kind this operation accepts.
    public RecordKind recordKind() {
        return recordKind;
    }

    /// Returns the largest absolute rule weight accepted for this operation's rules.
    public double maxAbsWeight() {
        return maxAbsWeight;
    }
}
