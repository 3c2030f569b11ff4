package io.creditx.core.rule;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.util.Objects;
import java.util.OptionalDouble;

/// Fires when a numeric feature satisfies `value <operator> threshold`.
///
/// @param id rule identifier, not null
/// @param feature numeric feature, not null
/// @param operator comparison, not null
/// @param threshold threshold value
/// @param weight contribution when fired
/// @param reason reason template, not null
public record ThresholdRule(
        String id,
        Feature feature,
        ComparisonOperator operator,
        double threshold,
        double weight,
        ReasonTemplate reason)
        implements Rule {

    public static final String TYPE = "threshold";

    public ThresholdRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OptionalDouble evaluate(FeatureSet features) {
        return operator.test(features.number(feature), threshold)
                ? OptionalDouble.of(weight)
                : OptionalDouble.empty();
    }
}
