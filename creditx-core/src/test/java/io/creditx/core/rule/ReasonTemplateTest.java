package io.creditx.core.rule;

import static org.assertj.core.api.Assertions.assertThat;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import io.creditx.core.record.RecordKind;
import io.creditx.core.record.Sector;
import org.junit.jupiter.api.Test;

class ReasonTemplateTest {

    private final FeatureSet features =
            FeatureSet.builder(RecordKind.SUBMISSION)
                    .number(Feature.BROKER_HIT_RATE, 0.85)
                    .number(Feature.DEBTOR_DAYS, 45)
                    .flag(Feature.FINANCIALS_ATTACHED, true)
                    .category(Feature.SECTOR, Sector.LOGISTICS)
                    .build();

    @Test
    void shouldRenderFeatureValues() {
        ReasonTemplate template = ReasonTemplate.of("Good broker hit rate ({broker_hit_rate})");

        assertThat(template.render(features, 0.3)).isEqualTo("Good broker hit rate (0.85)");
    }

    @Test
    void shouldRenderWholeNumbersWithoutDecimals() {
        assertThat(ReasonTemplate.of("Debtor days {debtor_days}").render(features, 0.1))
                .isEqualTo("Debtor days 45");
    }

    @Test
    void shouldRenderSignedWeight() {
        ReasonTemplate template = ReasonTemplate.of("Financials attached ({weight} bps)");

        assertThat(template.render(features, -15)).isEqualTo("Financials attached (-15 bps)");
        assertThat(template.render(features, 25)).isEqualTo("Financials attached (+25 bps)");
    }

    @Test
    void shouldRenderCategoriesAndFlags() {
        assertThat(
                        ReasonTemplate.of("{sector} submission, financials {financials_attached}")
                                .render(features, 0))
                .isEqualTo("Logistics submission, financials true");
    }

    @Test
    void shouldLeaveUnknownTokensUntouched() {
        assertThat(ReasonTemplate.of("Value {unknown} and {claims_ratio}").render(features, 0))
                .isEqualTo("Value {unknown} and {claims_ratio}");
    }

    @Test
    void shouldListPlaceholdersInOrder() {
        assertThat(ReasonTemplate.of("{weight} for { debtor_days } and {sector}").placeholders())
                .containsExactly("weight", "debtor_days", "sector");
    }

    @Test
    void shouldFormatNumbersToFourDecimals() {
        assertThat(ReasonTemplate.formatNumber(0.123456)).isEqualTo("0.1235");
        assertThat(ReasonTemplate.formatNumber(1.50)).isEqualTo("1.5");
        assertThat(ReasonTemplate.formatNumber(100)).isEqualTo("100");
        assertThat(ReasonTemplate.formatSigned(0)).isEqualTo("+0");
        assertThat(ReasonTemplate.formatSigned(-0.15)).isEqualTo("-0.15");
    }
}
