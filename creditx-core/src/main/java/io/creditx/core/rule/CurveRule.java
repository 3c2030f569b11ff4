package io.creditx.core.rule;

import io.creditx.core.config.ScoreCurve;
import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.util.Objects;
import java.util.OptionalDouble;

/// Maps a numeric feature through a curve and contributes `weight * curve(value)`.
///
/// Fires whenever the curve value is non-zero, so a curve that drops to zero outside the
/// interesting range keeps the rule silent there.
///
/// @param id rule identifier, not null
/// @param feature numeric feature, not null
/// @param curve lookup curve, not null
/// @param weight scale applied to the curve value
/// @param reason reason template, not null
public record CurveRule(
        String id, Feature feature, ScoreCurve curve, double weight, ReasonTemplate reason)
        implements Rule {

    public static final String TYPE = "curve";

    public CurveRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(curve, "curve must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OptionalDouble evaluate(FeatureSet features) {
        double factor = curve.valueAt(features.number(feature));
        return factor != 0.0 ? OptionalDouble.of(weight * factor) : OptionalDouble.empty();
    }
}
