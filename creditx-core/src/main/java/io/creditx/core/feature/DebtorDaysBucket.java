package io.creditx.core.feature;

/// Debtor-days band of a submission.
public enum DebtorDaysBucket {
    SHORT,
    MODERATE,
    LONG
}
