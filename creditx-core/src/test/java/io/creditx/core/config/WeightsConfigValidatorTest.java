package io.creditx.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.creditx.core.TestWeights;
import io.creditx.core.feature.Feature;
import io.creditx.core.record.Sector;
import io.creditx.core.rule.ComparisonOperator;
import io.creditx.core.rule.CurveRule;
import io.creditx.core.rule.FlagRule;
import io.creditx.core.rule.MembershipRule;
import io.creditx.core.rule.ReasonTemplate;
import io.creditx.core.rule.RuleSet;
import io.creditx.core.rule.ThresholdRule;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WeightsConfigValidatorTest {

    @Test
    void shouldAcceptCompleteConfiguration() {
        assertThat(WeightsConfigValidator.problems(TestWeights.config())).isEmpty();
        assertThatCode(() -> WeightsConfigValidator.validate(TestWeights.config()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("reports every problem in one exception")
    void shouldCollectAllProblems() {
        WeightsConfig config =
                TestWeights.builder()
                        .version(" ")
                        .sectorBaseRates(Map.of(Sector.RETAIL, 220))
                        .pricingBounds(new PricingBounds(400, 100))
                        .build();

        assertThatThrownBy(() -> WeightsConfigValidator.validate(config))
                .isInstanceOfSatisfying(
                        ConfigException.class,
                        e ->
                                assertThat(e.getProblems())
                                        .hasSize(1 + 5 + 1)
                                        .contains(
                                                "version must be a non-empty string",
                                                "sector_base_rates is missing sector Agri",
                                                "pricing_bounds.min_rate must not exceed"
                                                        + " pricing_bounds.max_rate"));
    }

    @Test
    void shouldRejectNegativeBaseRateAndCoverageOutsideUnitRange() {
        WeightsConfig config =
                TestWeights.builder()
                        .sectorBaseRate(Sector.OTHER, -1)
                        .sectorCoverageLimit(Sector.AGRI, 1.5)
                        .build();

        assertThat(WeightsConfigValidator.problems(config))
                .containsExactly(
                        "sector_base_rates.Other must be >= 0",
                        "sector_coverage_limits.Agri must be within [0, 1]");
    }

    @Test
    void shouldRejectDescendingCurve() {
        WeightsConfig config =
                TestWeights.builder().hitRateCurve(ScoreCurve.of(0.5, 0.5, 0.2, 0.9)).build();

        assertThat(WeightsConfigValidator.problems(config))
                .containsExactly("hit_rate_curve x values must be strictly ascending at index 1");
    }

    @Test
    void shouldRejectUnorderedThresholds() {
        WeightsConfig config =
                TestWeights.builder()
                        .thresholds(
                                FeatureThresholds.builder()
                                        .expiryUrgentDays(120)
                                        .claimsCountSevere(0)
                                        .build())
                        .build();

        assertThat(WeightsConfigValidator.problems(config))
                .containsExactly(
                        "thresholds.expiry_urgent_days must not exceed thresholds.expiry_soon_days",
                        "thresholds.claims_count_severe must be >= 1");
    }

    @Nested
    class RuleSets {

        @Test
        void shouldRejectDuplicateRuleIds() {
            FlagRule rule =
                    new FlagRule(
                            "dup", Feature.FINANCIALS_ATTACHED, true, 0.1, ReasonTemplate.of("x"));

            List<String> problems =
                    WeightsConfigValidator.problems(
                            TestWeights.builder().triageRules(RuleSet.of(rule, rule)).build());

            assertThat(problems).containsExactly("triage_rules[1] duplicates rule id 'dup'");
        }

        @Test
        void shouldRejectFeatureOfOtherRecordKind() {
            ThresholdRule rule =
                    new ThresholdRule(
                            "util",
                            Feature.UTILIZATION_PCT,
                            ComparisonOperator.GT,
                            0.8,
                            0.1,
                            ReasonTemplate.of("High utilization"));

            List<String> problems =
                    WeightsConfigValidator.problems(
                            TestWeights.builder().triageRules(RuleSet.of(rule)).build());

            assertThat(problems)
                    .singleElement()
                    .asString()
                    .contains("'utilization_pct' which is not extracted for SUBMISSION records");
        }

        @Test
        void shouldRejectRuleKindNotMatchingFeatureType() {
            FlagRule rule =
                    new FlagRule("days", Feature.DEBTOR_DAYS, true, 0.1, ReasonTemplate.of("x"));

            List<String> problems =
                    WeightsConfigValidator.problems(
                            TestWeights.builder().triageRules(RuleSet.of(rule)).build());

            assertThat(problems)
                    .singleElement()
                    .asString()
                    .contains("is a flag rule and needs a FLAG feature");
        }

        @Test
        void shouldRejectMembershipValueOutsideVocabulary() {
            MembershipRule rule =
                    new MembershipRule(
                            "bucket",
                            Feature.DEBTOR_DAYS_BUCKET,
                            List.of("LONG", "VERY_LONG"),
                            -0.1,
                            ReasonTemplate.of("x"));

            List<String> problems =
                    WeightsConfigValidator.problems(
                            TestWeights.builder().triageRules(RuleSet.of(rule)).build());

            assertThat(problems)
                    .containsExactly(
                            "triage_rules.bucket value 'VERY_LONG' is not one of"
                                    + " [SHORT, MODERATE, LONG]");
        }

        @Test
        void shouldAllowAnyBrokerName() {
            MembershipRule rule =
                    new MembershipRule(
                            "preferred",
                            Feature.BROKER,
                            List.of("Acme Brokers"),
                            0.05,
                            ReasonTemplate.of("Preferred broker {broker}"));

            assertThat(
                            WeightsConfigValidator.problems(
                                    TestWeights.builder().triageRules(RuleSet.of(rule)).build()))
                    .isEmpty();
        }

        @Test
        void shouldLimitScoreWeightsButNotPricingWeights() {
            FlagRule heavy =
                    new FlagRule(
                            "heavy", Feature.HAS_JUDGEMENTS, true, 60, ReasonTemplate.of("x"));

            assertThat(
                            WeightsConfigValidator.problems(
                                    TestWeights.builder().triageRules(RuleSet.of(heavy)).build()))
                    .containsExactly("triage_rules.heavy weight 60.0 is outside [-1, 1]");
            assertThat(
                            WeightsConfigValidator.problems(
                                    TestWeights.builder().pricingRules(RuleSet.of(heavy)).build()))
                    .isEmpty();
        }

        @Test
        void shouldRejectUnknownPlaceholder() {
            FlagRule rule =
                    new FlagRule(
                            "fin",
                            Feature.FINANCIALS_ATTACHED,
                            true,
                            0.2,
                            ReasonTemplate.of("Financials for {company_name}"));

            assertThat(
                            WeightsConfigValidator.problems(
                                    TestWeights.builder().triageRules(RuleSet.of(rule)).build()))
                    .containsExactly(
                            "triage_rules.fin reason references unknown placeholder"
                                    + " {company_name}");
        }

        @Test
        void shouldRejectCurveValuesOutsideUnitRange() {
            CurveRule rule =
                    new CurveRule(
                            "quality",
                            Feature.BROKER_QUALITY,
                            ScoreCurve.of(0.0, 0.0, 1.0, 2.0),
                            0.3,
                            ReasonTemplate.of("Broker quality"));

            assertThat(
                            WeightsConfigValidator.problems(
                                    TestWeights.builder().triageRules(RuleSet.of(rule)).build()))
                    .containsExactly("triage_rules.quality.curve values must be within [-1, 1]");
        }
    }

    @Nested
    class Bands {

        @Test
        void shouldRejectGapBetweenBands() {
            BandTable bands =
                    new BandTable(
                            List.of(
                                    new Band("A", null, null, 0, 100),
                                    new Band("B", null, null, 120, 200)));

            assertThat(WeightsConfigValidator.problems(TestWeights.builder().bands(bands).build()))
                    .containsExactly("bands leave a gap between A and B");
        }

        @Test
        void shouldRejectOverlappingBands() {
            BandTable bands =
                    new BandTable(
                            List.of(
                                    new Band("A", null, null, 0, 100),
                                    new Band("B", null, null, 90, 200)));

            assertThat(WeightsConfigValidator.problems(TestWeights.builder().bands(bands).build()))
                    .containsExactly("bands.B overlaps or precedes bands.A");
        }

        @Test
        void shouldRejectEmptyIntervalAndDuplicateCode() {
            BandTable bands =
                    new BandTable(
                            List.of(
                                    new Band("A", null, null, 0, 0),
                                    new Band("A", null, null, 0, 10)));

            assertThat(WeightsConfigValidator.problems(TestWeights.builder().bands(bands).build()))
                    .containsExactly(
                            "bands.A has an empty interval", "bands[1] duplicates band code 'A'");
        }
    }
}
