package io.creditx.core.batch;

/// How feature-importance counts are keyed.
public enum ImportanceKey {
    RULE_ID, // stable rule id; templated reasons with different values share one key
    REASON // rendered reason text
}
