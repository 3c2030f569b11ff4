package io.creditx.core.engine;

import io.creditx.core.config.Band;
import io.creditx.core.config.PricingBounds;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.feature.FeatureSet;
import io.creditx.core.rule.ReasonTemplate;
import io.creditx.core.rule.RuleFiring;
import java.util.ArrayList;
import java.util.List;

/// Suggests an indicative rate for a submission and classifies it into a risk band.
///
/// The rate starts at the sector base rate. Pricing rules then add signed basis-point
/// adjustments in configuration order, with no clamping between adjustments. If pricing
/// bounds are configured the final rate is clipped and a `rate_floor` or `rate_ceiling`
/// adjustment records the clip. The rate is rounded to whole basis points and mapped to a band
/// through {@link io.creditx.core.config.BandTable#classify}.
///
/// @implNote Stateless and thread-safe.
///
/// @see RuleEngine for the score-space variant
public final class PricingClassifier {

    /// Adjustment id recorded when the suggested rate is raised to the floor.
    public static final String RATE_FLOOR_ID = "rate_floor";

    /// Adjustment id recorded when the suggested rate is lowered to the ceiling.
    public static final String RATE_CEILING_ID = "rate_ceiling";

    private final RuleEngine ruleEngine;

    public PricingClassifier(RuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    /// Prices one submission.
    ///
    /// @param id submission id, may be null
    /// @param baseRateBps sector base rate
    /// @param features extracted submission features, not null
    /// @param config active weights snapshot, not null
    /// @return suggestion with band and adjustments, never null
    public PriceSuggestion classify(
            String id, int baseRateBps, FeatureSet features, WeightsConfig config) {
        List<RuleFiring> firings =
                new ArrayList<>(ruleEngine.evaluate(features, config.getPricingRules()));

        double rate = baseRateBps;
        for (RuleFiring firing : firings) {
            rate += firing.contribution();
        }

        PricingBounds bounds = config.getPricingBounds();
        if (bounds != null) {
            double clipped = bounds.clip(rate);
            if (clipped > rate) {
                firings.add(clip(RATE_FLOOR_ID, "minimum", bounds.minRateBps(), clipped - rate));
            } else if (clipped < rate) {
                firings.add(clip(RATE_CEILING_ID, "maximum", bounds.maxRateBps(), clipped - rate));
            }
            rate = clipped;
        }

        int suggested = (int) Math.round(rate);
        Band band = config.getBands().classify(suggested);

        List<String> adjustments = new ArrayList<>(firings.size());
        for (RuleFiring firing : firings) {
            adjustments.add(firing.reason());
        }

        return new PriceSuggestion(
                id,
                band.code(),
                band.label(),
                band.description(),
                baseRateBps,
                suggested,
                adjustments,
                firings);
    }

    private static RuleFiring clip(String id, String which, int boundBps, double delta) {
        return new RuleFiring(
                id,
                "Rate clipped to " + which + " (" + ReasonTemplate.formatNumber(boundBps) + " bps)",
                delta);
    }
}
