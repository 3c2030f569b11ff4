package io.creditx.core.engine;

import io.creditx.core.feature.FeatureSet;
import io.creditx.core.rule.Rule;
import io.creditx.core.rule.RuleFiring;
import io.creditx.core.rule.RuleSet;
import java.util.ArrayList;
import java.util.List;

/// Weighted-rule scoring engine for triage and renewal priority.
///
/// Starting from zero, every rule in the rule set is evaluated in list order; a firing rule
/// adds its contribution and appends its rendered reason. The final sum is clamped to
/// `[0, 1]`. Each rule fires at most once per record.
///
/// ### Contracts
/// - **Precondition**: the rule set passed validation for the features' record kind
/// - **Postcondition**: `0 <= score <= 1`; `reasons` and `firings` follow rule order
/// - **Invariant**: identical inputs give identical results (no hidden state)
///
/// @implNote Stateless and thread-safe.
///
/// @see PricingClassifier for the basis-point variant
public final class RuleEngine {

    /// Scores one record.
    ///
    /// ### Performance
    /// - Time: O(n) where n = number of rules
    ///
    /// @param id record id, may be null
    /// @param features extracted features, not null
    /// @param rules rules in evaluation order, not null
    /// @return clamped score with reasons, never null
    public ScoreResult score(String id, FeatureSet features, RuleSet rules) {
        List<RuleFiring> firings = evaluate(features, rules);

        double score = 0.0;
        List<String> reasons = new ArrayList<>(firings.size());
        for (RuleFiring firing : firings) {
            score += firing.contribution();
            reasons.add(firing.reason());
        }

        return new ScoreResult(id, clamp(score), reasons, firings);
    }

    /// Evaluates every rule in order and returns the firings.
    ///
    /// @param features extracted features, not null
    /// @param rules rules in evaluation order, not null
    /// @return firings in rule order, never null
    List<RuleFiring> evaluate(FeatureSet features, RuleSet rules) {
        List<RuleFiring> firings = new ArrayList<>();
        for (Rule rule : rules.rules()) {
            RuleFiring firing = rule.fire(features);
            if (firing != null) {
                firings.add(firing);
            }
        }
        return firings;
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
