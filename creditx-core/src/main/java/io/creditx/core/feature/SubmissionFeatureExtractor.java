package io.creditx.core.feature;

import io.creditx.core.config.FeatureThresholds;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.record.RecordKind;
import io.creditx.core.record.SubmissionRecord;

/// Derives triage and pricing features from a new-business submission.
///
/// Besides passing raw fields through, it computes:
/// - `log_exposure` as `log1p(exposure_limit)`
/// - `debtor_days_bucket`: `SHORT` at or below the short maximum, `LONG` above the long
///   minimum, otherwise `MODERATE`
/// - `trading_history`: `LIMITED` below the limited bound, `ESTABLISHED` from the established
///   bound, otherwise `STANDARD`
/// - `broker_quality` from the configured hit-rate curve
/// - `coverage_above_sector_limit` when requested coverage exceeds the sector's limit
///
/// @implNote Stateless and thread-safe.
public final class SubmissionFeatureExtractor implements FeatureExtractor<SubmissionRecord> {

    @Override
    public FeatureSet extract(SubmissionRecord record, WeightsConfig config) {
        FeatureThresholds thresholds = config.getThresholds();

        return FeatureSet.builder(RecordKind.SUBMISSION)
                .number(Feature.EXPOSURE_LIMIT, record.exposureLimit())
                .number(Feature.LOG_EXPOSURE, Math.log1p(record.exposureLimit()))
                .number(Feature.DEBTOR_DAYS, record.debtorDays())
                .category(
                        Feature.DEBTOR_DAYS_BUCKET,
                        debtorDaysBucket(record.debtorDays(), thresholds))
                .flag(Feature.FINANCIALS_ATTACHED, record.financialsAttached())
                .number(Feature.YEARS_TRADING, record.yearsTrading())
                .category(
                        Feature.TRADING_HISTORY, tradingHistory(record.yearsTrading(), thresholds))
                .number(Feature.BROKER_HIT_RATE, record.brokerHitRate())
                .number(
                        Feature.BROKER_QUALITY,
                        config.getHitRateCurve().valueAt(record.brokerHitRate()))
                .number(Feature.REQUESTED_COV_PCT, record.requestedCovPct())
                .flag(
                        Feature.COVERAGE_ABOVE_SECTOR_LIMIT,
                        record.requestedCovPct() > config.coverageLimitFor(record.sector()))
                .flag(Feature.HAS_JUDGEMENTS, record.hasJudgements())
                .category(Feature.SECTOR, record.sector())
                .category(Feature.BROKER, record.broker() != null ? record.broker() : "")
                .build();
    }

    static DebtorDaysBucket debtorDaysBucket(double debtorDays, FeatureThresholds thresholds) {
        if (debtorDays <= thresholds.getDebtorDaysShortMax()) {
            return DebtorDaysBucket.SHORT;
        }
        if (debtorDays > thresholds.getDebtorDaysLongMin()) {
            return DebtorDaysBucket.LONG;
        }
        return DebtorDaysBucket.MODERATE;
    }

    static TradingHistory tradingHistory(double yearsTrading, FeatureThresholds thresholds) {
        if (yearsTrading < thresholds.getTradingLimitedBelow()) {
            return TradingHistory.LIMITED;
        }
        if (yearsTrading >= thresholds.getTradingEstablishedFrom()) {
            return TradingHistory.ESTABLISHED;
        }
        return TradingHistory.STANDARD;
    }
}
