package io.creditx.core.feature;

import io.creditx.core.config.WeightsConfig;
import io.creditx.core.record.UnderwritingRecord;

/// Pure mapping from a validated record and the active weights to its derived features.
///
/// Implementations have no side effects and never fail on in-range inputs; range checks are
/// the ingestion collaborator's job.
///
/// @param <R> record type handled
@FunctionalInterface
public interface FeatureExtractor<R extends UnderwritingRecord> {

    /// Extracts features from a record.
    ///
    /// @param record validated record, not null
    /// @param config active weights snapshot, not null
    /// @return extracted features, never null
    FeatureSet extract(R record, WeightsConfig config);
}
