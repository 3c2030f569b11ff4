package io.creditx.core.feature;

import static org.assertj.core.api.Assertions.assertThat;

import io.creditx.core.TestWeights;
import io.creditx.core.config.FeatureThresholds;
import io.creditx.core.record.RecordKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PolicyFeatureExtractorTest {

    private final PolicyFeatureExtractor extractor = new PolicyFeatureExtractor();
    private final FeatureThresholds thresholds = FeatureThresholds.defaults();

    @Test
    void shouldExtractPolicyFeatures() {
        FeatureSet features =
                extractor.extract(
                        TestWeights.policy("P-1", 0.85, 2, 1.8, 25, -0.2), TestWeights.config());

        assertThat(features.kind()).isEqualTo(RecordKind.POLICY);
        assertThat(features.number(Feature.CLAIMS_COUNT)).isEqualTo(2);
        assertThat(features.category(Feature.UTILIZATION_BUCKET)).isEqualTo("HIGH");
        assertThat(features.category(Feature.CLAIMS_SEVERITY)).isEqualTo("ELEVATED");
        assertThat(features.category(Feature.EXPIRY_URGENCY)).isEqualTo("URGENT");
        assertThat(features.category(Feature.CHANGE_DIRECTION)).isEqualTo("DECREASE");
        assertThat(features.category(Feature.SECTOR)).isEqualTo("Logistics");
        assertThat(features.contains(Feature.DEBTOR_DAYS)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({"0,URGENT", "30,URGENT", "31,SOON", "90,SOON", "91,LATER"})
    void shouldClassifyExpiryUrgency(double days, ExpiryUrgency expected) {
        assertThat(PolicyFeatureExtractor.expiryUrgency(days, thresholds)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"0.1,LOW", "0.3,LOW", "0.5,MODERATE", "0.8,HIGH", "1.0,HIGH"})
    void shouldClassifyUtilization(double utilization, UtilizationBucket expected) {
        assertThat(PolicyFeatureExtractor.utilizationBucket(utilization, thresholds))
                .isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"0,0,NONE", "1,0.4,LOW", "2,1.5,ELEVATED", "1,3.0,SEVERE", "5,0.2,SEVERE"})
    void shouldClassifyClaimsSeverity(int count, double ratio, ClaimsSeverity expected) {
        assertThat(PolicyFeatureExtractor.claimsSeverity(count, ratio, thresholds))
                .isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"0.25,INCREASE", "0.1,FLAT", "0,FLAT", "-0.1,FLAT", "-0.15,DECREASE"})
    void shouldClassifyChangeDirection(double change, ChangeDirection expected) {
        assertThat(PolicyFeatureExtractor.changeDirection(change, thresholds)).isEqualTo(expected);
    }
}
