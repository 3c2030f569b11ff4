package io.creditx.core.batch;

import java.io.Serial;

/// Thrown when a single record cannot be scored.
///
/// Caught per record by the {@link BatchAggregator} and reported as a {@link RecordFailure};
/// it never aborts the rest of the batch.
public class RecordException extends Exception {
    @Serial private static final long serialVersionUID = 7931645307788210466L;

    private final String recordId;

    public RecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    /// Returns the id of the failing record.
    ///
    /// @return record id, may be null if the record had none
    public String getRecordId() {
        return recordId;
    }
}
