package io.creditx.core.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.creditx.core.config.ScoreCurve;
import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import io.creditx.core.record.RecordKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleTest {

    private final FeatureSet features =
            FeatureSet.builder(RecordKind.SUBMISSION)
                    .number(Feature.DEBTOR_DAYS, 90)
                    .number(Feature.BROKER_HIT_RATE, 0.4)
                    .flag(Feature.HAS_JUDGEMENTS, false)
                    .category(Feature.DEBTOR_DAYS_BUCKET, "MODERATE")
                    .build();

    @Test
    void thresholdRuleShouldFireWhenComparisonHolds() {
        ThresholdRule rule =
                new ThresholdRule(
                        "high_debtor_days",
                        Feature.DEBTOR_DAYS,
                        ComparisonOperator.GT,
                        60,
                        25,
                        ReasonTemplate.of("High debtor days ({weight} bps)"));

        assertThat(rule.fire(features))
                .isEqualTo(new RuleFiring("high_debtor_days", "High debtor days (+25 bps)", 25));
    }

    @Test
    void thresholdRuleShouldStaySilentOtherwise() {
        ThresholdRule rule =
                new ThresholdRule(
                        "short",
                        Feature.DEBTOR_DAYS,
                        ComparisonOperator.LTE,
                        60,
                        0.1,
                        ReasonTemplate.of("Short debtor days"));

        assertThat(rule.evaluate(features)).isEmpty();
        assertThat(rule.fire(features)).isNull();
    }

    @Test
    void flagRuleShouldMatchExpectedValue() {
        FlagRule clean =
                new FlagRule(
                        "no_judgements",
                        Feature.HAS_JUDGEMENTS,
                        false,
                        0.1,
                        ReasonTemplate.of("x"));
        FlagRule dirty =
                new FlagRule(
                        "judgements", Feature.HAS_JUDGEMENTS, true, -0.3, ReasonTemplate.of("x"));

        assertThat(clean.evaluate(features)).hasValue(0.1);
        assertThat(dirty.evaluate(features)).isEmpty();
    }

    @Test
    void membershipRuleShouldFireForListedCategory() {
        MembershipRule rule =
                new MembershipRule(
                        "not_short",
                        Feature.DEBTOR_DAYS_BUCKET,
                        List.of("MODERATE", "LONG"),
                        -0.05,
                        ReasonTemplate.of("Debtor days {debtor_days_bucket}"));

        RuleFiring firing = rule.fire(features);

        assertThat(firing.reason()).isEqualTo("Debtor days MODERATE");
        assertThat(firing.contribution()).isEqualTo(-0.05);
    }

    @Test
    void curveRuleShouldScaleWeightByCurveValue() {
        CurveRule rule =
                new CurveRule(
                        "broker_curve",
                        Feature.BROKER_HIT_RATE,
                        ScoreCurve.of(0.0, 0.0, 0.2, 0.0, 1.0, 1.0),
                        0.5,
                        ReasonTemplate.of("Broker curve ({weight})"));

        RuleFiring firing = rule.fire(features);

        assertThat(firing.contribution()).isCloseTo(0.125, within(1e-9));
        assertThat(firing.reason()).isEqualTo("Broker curve (+0.125)");
    }

    @Test
    void curveRuleShouldStaySilentWhereCurveIsZero() {
        CurveRule rule =
                new CurveRule(
                        "broker_curve",
                        Feature.BROKER_HIT_RATE,
                        ScoreCurve.of(0.0, 0.0, 0.5, 0.0, 1.0, 1.0),
                        0.5,
                        ReasonTemplate.of("x"));

        assertThat(rule.fire(features)).isNull();
    }

    @Test
    void equalityRuleShouldFireForNegativeZeroChange() {
        FeatureSet policy =
                FeatureSet.builder(RecordKind.POLICY)
                        .number(Feature.REQUESTED_CHANGE_PCT, -0.0)
                        .build();
        ThresholdRule rule =
                new ThresholdRule(
                        "unchanged_terms",
                        Feature.REQUESTED_CHANGE_PCT,
                        ComparisonOperator.EQ,
                        0.0,
                        0.05,
                        ReasonTemplate.of("No change requested"));

        assertThat(rule.fire(policy))
                .isEqualTo(new RuleFiring("unchanged_terms", "No change requested", 0.05));
    }
}
