package io.creditx.core.feature;

import io.creditx.core.record.RecordKind;
import io.creditx.core.record.Sector;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Closed vocabulary of features the extractors produce.
///
/// Rules and reason templates may only reference features listed here, and only those
/// produced for the record kind their rule set scores. Keys are the names used in weights
/// files and in `{placeholder}` tokens.
///
/// @see FeatureSet for extracted values
/// @see SubmissionFeatureExtractor
/// @see PolicyFeatureExtractor
public enum Feature {

    // Submission features
    EXPOSURE_LIMIT("exposure_limit", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    LOG_EXPOSURE("log_exposure", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    DEBTOR_DAYS("debtor_days", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    DEBTOR_DAYS_BUCKET("debtor_days_bucket", DebtorDaysBucket.class, RecordKind.SUBMISSION),
    FINANCIALS_ATTACHED("financials_attached", FeatureType.FLAG, RecordKind.SUBMISSION),
    YEARS_TRADING("years_trading", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    TRADING_HISTORY("trading_history", TradingHistory.class, RecordKind.SUBMISSION),
    BROKER_HIT_RATE("broker_hit_rate", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    BROKER_QUALITY("broker_quality", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    REQUESTED_COV_PCT("requested_cov_pct", FeatureType.NUMERIC, RecordKind.SUBMISSION),
    COVERAGE_ABOVE_SECTOR_LIMIT(
            "coverage_above_sector_limit", FeatureType.FLAG, RecordKind.SUBMISSION),
    HAS_JUDGEMENTS("has_judgements", FeatureType.FLAG, RecordKind.SUBMISSION),

    // Policy features
    CURRENT_PREMIUM("current_premium", FeatureType.NUMERIC, RecordKind.POLICY),
    LIMIT("limit", FeatureType.NUMERIC, RecordKind.POLICY),
    UTILIZATION_PCT("utilization_pct", FeatureType.NUMERIC, RecordKind.POLICY),
    UTILIZATION_BUCKET("utilization_bucket", UtilizationBucket.class, RecordKind.POLICY),
    CLAIMS_COUNT("claims_count", FeatureType.NUMERIC, RecordKind.POLICY),
    CLAIMS_RATIO("claims_ratio", FeatureType.NUMERIC, RecordKind.POLICY),
    CLAIMS_SEVERITY("claims_severity", ClaimsSeverity.class, RecordKind.POLICY),
    DAYS_TO_EXPIRY("days_to_expiry", FeatureType.NUMERIC, RecordKind.POLICY),
    EXPIRY_URGENCY("expiry_urgency", ExpiryUrgency.class, RecordKind.POLICY),
    REQUESTED_CHANGE_PCT("requested_change_pct", FeatureType.NUMERIC, RecordKind.POLICY),
    CHANGE_DIRECTION("change_direction", ChangeDirection.class, RecordKind.POLICY),

    // Shared
    SECTOR("sector", Sector.class, RecordKind.SUBMISSION, RecordKind.POLICY),
    BROKER("broker", FeatureType.CATEGORY, RecordKind.SUBMISSION, RecordKind.POLICY);

    private final String key;
    private final FeatureType type;
    private final Set<RecordKind> kinds;
    private final List<String> vocabulary;

    Feature(String key, FeatureType type, RecordKind first, RecordKind... rest) {
        this.key = key;
        this.type = type;
        this.kinds = EnumSet.of(first, rest);
        this.vocabulary = List.of();
    }

    Feature(String key, Class<? extends Enum<?>> buckets, RecordKind first, RecordKind... rest) {
        this.key = key;
        this.type = FeatureType.CATEGORY;
        this.kinds = EnumSet.of(first, rest);
        this.vocabulary =
                Arrays.stream(buckets.getEnumConstants()).map(Feature::categoryValue).toList();
    }

    /// Returns the key used in weights files and reason templates.
    ///
    /// @return snake_case key, never null
    public String key() {
        return key;
    }

    /// Returns the value type of this feature.
    ///
    /// @return feature type, never null
    public FeatureType type() {
        return type;
    }

    /// Checks whether extractors produce this feature for the given record kind.
    ///
    /// @param kind record kind, not null
    /// @return true if the feature is available for that kind
    public boolean appliesTo(RecordKind kind) {
        return kinds.contains(kind);
    }

    /// Returns the closed set of values a category feature can take.
    ///
    /// @return allowed values, empty for numeric, flag and open category features
    public List<String> vocabulary() {
        return vocabulary;
    }

    /// Resolves a feature by key.
    ///
    /// @param key snake_case key, may be null
    /// @return matching feature, or empty if unknown
    public static Optional<Feature> fromKey(String key) {
        for (Feature feature : values()) {
            if (feature.key.equals(key)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }

    /// Converts a bucket or sector constant to the string stored in a {@link FeatureSet}.
    static String categoryValue(Enum<?> value) {
        return value instanceof Sector sector ? sector.label() : value.name();
    }
}
