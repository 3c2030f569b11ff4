package io.creditx.core.feature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.creditx.core.record.RecordKind;
import org.junit.jupiter.api.Test;

class FeatureSetTest {

    @Test
    void shouldRejectValueOfWrongType() {
        assertThatThrownBy(
                        () ->
                                FeatureSet.builder(RecordKind.SUBMISSION)
                                        .flag(Feature.DEBTOR_DAYS, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("debtor_days");
    }

    @Test
    void shouldRejectFeatureOfOtherRecordKind() {
        assertThatThrownBy(
                        () ->
                                FeatureSet.builder(RecordKind.POLICY)
                                        .number(Feature.DEBTOR_DAYS, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not apply to POLICY");
    }

    @Test
    void shouldRejectTypedReadOfWrongType() {
        FeatureSet features =
                FeatureSet.builder(RecordKind.SUBMISSION).number(Feature.DEBTOR_DAYS, 10).build();

        assertThatThrownBy(() -> features.flag(Feature.DEBTOR_DAYS))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCompareByValue() {
        FeatureSet a =
                FeatureSet.builder(RecordKind.POLICY).number(Feature.CLAIMS_RATIO, 0.4).build();
        FeatureSet b =
                FeatureSet.builder(RecordKind.POLICY).number(Feature.CLAIMS_RATIO, 0.4).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.asMap()).containsEntry(Feature.CLAIMS_RATIO, 0.4);
    }

    @Test
    void shouldResolveFeaturesByKey() {
        assertThat(Feature.fromKey("requested_cov_pct")).contains(Feature.REQUESTED_COV_PCT);
        assertThat(Feature.fromKey("nope")).isEmpty();
        assertThat(Feature.SECTOR.vocabulary())
                .containsExactly(
                        "Retail", "Manufacturing", "Logistics", "Agri", "Services", "Other");
        assertThat(Feature.SECTOR.appliesTo(RecordKind.POLICY)).isTrue();
    }
}
