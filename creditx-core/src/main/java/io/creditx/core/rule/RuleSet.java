package io.creditx.core.rule;

import java.util.List;
import java.util.Objects;

/// Ordered list of rules. Evaluation order is list order.
///
/// @param rules rules in evaluation order, not null (may be empty)
public record RuleSet(List<Rule> rules) {

    public RuleSet {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /// Creates a rule set from rules in evaluation order.
    public static RuleSet of(Rule... rules) {
        return new RuleSet(List.of(rules));
    }

    /// Returns an empty rule set.
    public static RuleSet empty() {
        return new RuleSet(List.of());
    }

    public int size() {
        return rules.size();
    }
}
