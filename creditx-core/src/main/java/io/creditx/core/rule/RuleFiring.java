package io.creditx.core.rule;

import java.util.Objects;

/// Record of one rule firing for one record.
///
/// @param ruleId identifier of the rule that fired, not null
/// @param reason rendered reason text, not null
/// @param contribution signed amount added to the running score or rate
public record RuleFiring(String ruleId, String reason, double contribution) {

    public RuleFiring {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
