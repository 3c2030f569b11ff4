package io.creditx.core.feature;

/// How soon a policy expires.
public enum ExpiryUrgency {
    URGENT,
    SOON,
    LATER
}
