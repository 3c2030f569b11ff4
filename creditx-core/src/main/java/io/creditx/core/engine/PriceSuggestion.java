package io.creditx.core.engine;

import io.creditx.core.rule.RuleFiring;
import java.util.List;
import java.util.Objects;

/// Indicative price for one submission, subject to underwriter override.
///
/// @param id submission id
/// @param bandCode code of the band containing the suggested rate
/// @param bandLabel band label
/// @param bandDescription band description
/// @param baseRateBps sector base rate
/// @param suggestedRateBps base rate plus adjustments, rounded to whole basis points
/// @param adjustments rendered adjustments in evaluation order, not null
/// @param firings adjustment firings in the same order as `adjustments`, not null
public record PriceSuggestion(
        String id,
        String bandCode,
        String bandLabel,
        String bandDescription,
        int baseRateBps,
        int suggestedRateBps,
        List<String> adjustments,
        List<RuleFiring> firings)
        implements RecordResult {

    public PriceSuggestion {
        adjustments =
                List.copyOf(Objects.requireNonNull(adjustments, "adjustments must not be null"));
        firings = List.copyOf(Objects.requireNonNull(firings, "firings must not be null"));
    }
}
