package io.creditx.core.record;

/// Shape of an underwriting record, used to bind rule sets and features to their input type.
public enum RecordKind {
    SUBMISSION,
    POLICY
}
