package io.creditx.core.record;

/// Sealed interface for validated records handed to the engine by an ingestion collaborator.
///
/// Records are immutable once accepted. Field-level validation (ranges, enum membership,
/// required fields) is the producer's responsibility; the engine only re-checks what it needs
/// to score safely.
///
/// ### Permitted Implementations
/// - {@link SubmissionRecord} - new business submission
/// - {@link PolicyRecord} - in-force policy up for renewal
public sealed interface UnderwritingRecord permits SubmissionRecord, PolicyRecord {

    /// Returns the record identity (submission or policy id).
    ///
    /// @return identifier, never null for accepted records
    String id();

    /// Returns the introducing broker.
    ///
    /// @return broker name, may be empty
    String broker();

    /// Returns the industry sector of the insured.
    ///
    /// @return sector, never null for accepted records
    Sector sector();

    /// Returns the record shape.
    ///
    /// @return record kind, never null
    RecordKind kind();
}
