package io.creditx.core.feature;

/// Limit utilisation band of a policy.
public enum UtilizationBucket {
    LOW,
    MODERATE,
    HIGH
}
