package io.creditx.core.feature;

/// Claims experience of a policy, derived from claim count and ratio.
public enum ClaimsSeverity {
    NONE,
    LOW,
    ELEVATED,
    SEVERE
}
