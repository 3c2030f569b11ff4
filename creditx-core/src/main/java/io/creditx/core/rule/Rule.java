package io.creditx.core.rule;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.util.OptionalDouble;

/// Sealed interface for named scoring and pricing rules.
///
/// A rule inspects one extracted feature. When its predicate holds it contributes a signed
/// amount (score units for triage and renewal rules, basis points for pricing rules) and a
/// rendered reason. Rules are evaluated in configuration order by the engine.
///
/// ### Permitted Implementations
/// - {@link ThresholdRule} - numeric feature compared against a threshold
/// - {@link FlagRule} - boolean feature equal to an expected value
/// - {@link MembershipRule} - category feature within a set of values
/// - {@link CurveRule} - numeric feature mapped through a curve, scaled by the weight
///
/// @implNote Implementations are immutable records. The same rule instance is evaluated
/// concurrently for different records.
///
/// @see io.creditx.core.engine.RuleEngine
public sealed interface Rule permits ThresholdRule, FlagRule, MembershipRule, CurveRule {

    /// Returns the rule identifier, unique within its rule set.
    String id();

    /// Returns the feature the predicate reads.
    Feature feature();

    /// Returns the configured weight.
    double weight();

    /// Returns the reason rendered when the rule fires.
    ReasonTemplate reason();

    /// Returns the discriminator used in weights files.
    ///
    /// @return type tag such as `"threshold"`, never null
    String type();

    /// Evaluates the rule against a record's features.
    ///
    /// @param features extracted features, not null
    /// @return signed contribution if the rule fires, empty otherwise
    OptionalDouble evaluate(FeatureSet features);

    /// Evaluates the rule and renders its firing.
    ///
    /// @param features extracted features, not null
    /// @return firing with rendered reason, or null if the rule does not fire
    default RuleFiring fire(FeatureSet features) {
        OptionalDouble contribution = evaluate(features);
        if (contribution.isEmpty()) {
            return null;
        }
        double amount = contribution.getAsDouble();
        return new RuleFiring(id(), reason().render(features, amount), amount);
    }
}
