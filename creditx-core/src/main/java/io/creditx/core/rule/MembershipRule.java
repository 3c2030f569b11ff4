package io.creditx.core.rule;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Fires when a category feature takes one of the listed values.
///
/// @param id rule identifier, not null
/// @param feature category feature, not null
/// @param values matching values, not null or empty
/// @param weight contribution when fired
/// @param reason reason template, not null
public record MembershipRule(
        String id, Feature feature, List<String> values, double weight, ReasonTemplate reason)
        implements Rule {

    public static final String TYPE = "membership";

    public MembershipRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OptionalDouble evaluate(FeatureSet features) {
        return values.contains(features.category(feature))
                ? OptionalDouble.of(weight)
                : OptionalDouble.empty();
    }
}
