package io.creditx.core.batch;

/// A record excluded from a batch result because it could not be scored.
///
/// @param index position of the record in the submitted batch
/// @param recordId id of the record, may be null
/// @param message why the record was excluded, not null
public record RecordFailure(int index, String recordId, String message) {}
