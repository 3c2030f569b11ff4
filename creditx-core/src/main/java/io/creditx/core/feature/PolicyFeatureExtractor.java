package io.creditx.core.feature;

import io.creditx.core.config.FeatureThresholds;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.record.PolicyRecord;
import io.creditx.core.record.RecordKind;

/// Derives renewal-priority features from an in-force policy.
///
/// Bucket features:
/// - `expiry_urgency`: `URGENT` within the urgent window, `SOON` within the soon window,
///   otherwise `LATER`
/// - `utilization_bucket`: `LOW`, `MODERATE` or `HIGH`
/// - `claims_severity`: `NONE` without claims, `SEVERE` when either the ratio or the count
///   reaches its severe threshold, `ELEVATED` from the elevated ratio, otherwise `LOW`
/// - `change_direction`: `INCREASE`/`DECREASE` beyond `±epsilon`, otherwise `FLAT`
///
/// @implNote Stateless and thread-safe.
public final class PolicyFeatureExtractor implements FeatureExtractor<PolicyRecord> {

    @Override
    public FeatureSet extract(PolicyRecord record, WeightsConfig config) {
        FeatureThresholds thresholds = config.getThresholds();

        return FeatureSet.builder(RecordKind.POLICY)
                .number(Feature.CURRENT_PREMIUM, record.currentPremium())
                .number(Feature.LIMIT, record.limit())
                .number(Feature.UTILIZATION_PCT, record.utilizationPct())
                .category(
                        Feature.UTILIZATION_BUCKET,
                        utilizationBucket(record.utilizationPct(), thresholds))
                .number(Feature.CLAIMS_COUNT, record.claimsLast24mCnt())
                .number(Feature.CLAIMS_RATIO, record.claimsRatio24m())
                .category(
                        Feature.CLAIMS_SEVERITY,
                        claimsSeverity(
                                record.claimsLast24mCnt(), record.claimsRatio24m(), thresholds))
                .number(Feature.DAYS_TO_EXPIRY, record.daysToExpiry())
                .category(
                        Feature.EXPIRY_URGENCY, expiryUrgency(record.daysToExpiry(), thresholds))
                .number(Feature.REQUESTED_CHANGE_PCT, record.requestedChangePct())
                .category(
                        Feature.CHANGE_DIRECTION,
                        changeDirection(record.requestedChangePct(), thresholds))
                .category(Feature.SECTOR, record.sector())
                .category(Feature.BROKER, record.broker() != null ? record.broker() : "")
                .build();
    }

    static ExpiryUrgency expiryUrgency(double daysToExpiry, FeatureThresholds thresholds) {
        if (daysToExpiry <= thresholds.getExpiryUrgentDays()) {
            return ExpiryUrgency.URGENT;
        }
        if (daysToExpiry <= thresholds.getExpirySoonDays()) {
            return ExpiryUrgency.SOON;
        }
        return ExpiryUrgency.LATER;
    }

    static UtilizationBucket utilizationBucket(double utilization, FeatureThresholds thresholds) {
        if (utilization >= thresholds.getUtilizationHighMin()) {
            return UtilizationBucket.HIGH;
        }
        if (utilization <= thresholds.getUtilizationLowMax()) {
            return UtilizationBucket.LOW;
        }
        return UtilizationBucket.MODERATE;
    }

    static ClaimsSeverity claimsSeverity(
            int claimsCount, double claimsRatio, FeatureThresholds thresholds) {
        if (claimsCount == 0 && claimsRatio == 0.0) {
            return ClaimsSeverity.NONE;
        }
        if (claimsRatio >= thresholds.getClaimsRatioSevere()
                || claimsCount >= thresholds.getClaimsCountSevere()) {
            return ClaimsSeverity.SEVERE;
        }
        if (claimsRatio >= thresholds.getClaimsRatioElevated()) {
            return ClaimsSeverity.ELEVATED;
        }
        return ClaimsSeverity.LOW;
    }

    static ChangeDirection changeDirection(double changePct, FeatureThresholds thresholds) {
        if (changePct > thresholds.getChangeEpsilon()) {
            return ChangeDirection.INCREASE;
        }
        if (changePct < -thresholds.getChangeEpsilon()) {
            return ChangeDirection.DECREASE;
        }
        return ChangeDirection.FLAT;
    }
}
