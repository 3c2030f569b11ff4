package io.creditx.core.batch;

import io.creditx.core.engine.Operation;
import io.creditx.core.engine.RecordResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Outcome of one batch call.
///
/// Every result in a batch was computed against the single weights snapshot named by
/// `weightsVersion`.
///
/// @param operation operation performed, not null
/// @param weightsVersion version of the snapshot used, not null
/// @param results successful per-record results in input order, not null
/// @param failures records excluded from `results`, in input order, not null
/// @param featureImportance label to number of successful records in which it fired, not null
/// @param <T> per-record result type
public record BatchResult<T extends RecordResult>(
        Operation operation,
        String weightsVersion,
        List<T> results,
        List<RecordFailure> failures,
        Map<String, Integer> featureImportance) {

    public BatchResult {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(weightsVersion, "weightsVersion must not be null");
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        featureImportance = Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
    }

    /// Checks whether every submitted record produced a result.
    ///
    /// @return true if no record failed
    public boolean isComplete() {
        return failures.isEmpty();
    }
}
