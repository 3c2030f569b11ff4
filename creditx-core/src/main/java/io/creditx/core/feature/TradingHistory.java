package io.creditx.core.feature;

/// Trading-history band of a submission.
public enum TradingHistory {
    LIMITED,
    STANDARD,
    ESTABLISHED
}
