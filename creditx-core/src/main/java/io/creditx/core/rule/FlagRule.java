package io.creditx.core.rule;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.util.Objects;
import java.util.OptionalDouble;

/// Fires when a boolean feature equals the expected value.
///
/// @param id rule identifier, not null
/// @param feature flag feature, not null
/// @param expected value that makes the rule fire
/// @param weight contribution when fired
/// @param reason reason template, not null
public record FlagRule(
        String id, Feature feature, boolean expected, double weight, ReasonTemplate reason)
        implements Rule {

    public static final String TYPE = "flag";

    public FlagRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OptionalDouble evaluate(FeatureSet features) {
        return features.flag(feature) == expected
                ? OptionalDouble.of(weight)
                : OptionalDouble.empty();
    }
}
