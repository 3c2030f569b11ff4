package io.creditx.core.feature;

/// Direction of a requested premium change.
public enum ChangeDirection {
    INCREASE,
    DECREASE,
    FLAT
}
