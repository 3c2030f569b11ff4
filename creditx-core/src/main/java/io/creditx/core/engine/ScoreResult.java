package io.creditx.core.engine;

import io.creditx.core.rule.RuleFiring;
import java.util.List;
import java.util.Objects;

/// Triage or renewal-priority score for one record.
///
/// The score is a suggestion for an underwriter, not a decision.
///
/// @param id record id
/// @param score clamped score in `[0, 1]`
/// @param reasons rendered reasons in rule evaluation order, not null
/// @param firings rule firings in the same order as `reasons`, not null
public record ScoreResult(String id, double score, List<String> reasons, List<RuleFiring> firings)
        implements RecordResult {

    public ScoreResult {
        reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons must not be null"));
        firings = List.copyOf(Objects.requireNonNull(firings, "firings must not be null"));
    }
}
