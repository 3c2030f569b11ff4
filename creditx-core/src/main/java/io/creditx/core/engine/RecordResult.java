package io.creditx.core.engine;

import io.creditx.core.rule.RuleFiring;
import java.util.List;

/// Sealed interface for per-record engine output.
///
/// ### Permitted Implementations
/// - {@link ScoreResult} - triage or renewal-priority score
/// - {@link PriceSuggestion} - indicative rate and band
public sealed interface RecordResult permits ScoreResult, PriceSuggestion {

    /// Returns the id of the scored record.
    String id();

    /// Returns every rule that fired, in evaluation order.
    List<RuleFiring> firings();
}
