package io.creditx.core.config;

/// Bucket boundaries used by the feature extractors.
///
/// Defaults reproduce the reason boundaries of the first weights release.
///
/// ### Validation Rules
/// Checked by {@link WeightsConfigValidator}:
/// - All values non-negative and finite
/// - `debtorDaysShortMax <= debtorDaysLongMin`
/// - `tradingLimitedBelow <= tradingEstablishedFrom`
/// - `expiryUrgentDays <= expirySoonDays`
/// - `utilizationLowMax <= utilizationHighMin`
/// - `claimsRatioElevated <= claimsRatioSevere`, `claimsCountSevere >= 1`
///
/// @implNote Immutable and thread-safe after construction.
public final class FeatureThresholds {

    private final double debtorDaysShortMax;
    private final double debtorDaysLongMin;
    private final double tradingLimitedBelow;
    private final double tradingEstablishedFrom;
    private final double expiryUrgentDays;
    private final double expirySoonDays;
    private final double utilizationLowMax;
    private final double utilizationHighMin;
    private final double claimsRatioElevated;
    private final double claimsRatioSevere;
    private final int claimsCountSevere;
    private final double changeEpsilon;

    private FeatureThresholds(Builder builder) {
        this.debtorDaysShortMax = builder.debtorDaysShortMax;
        this.debtorDaysLongMin = builder.debtorDaysLongMin;
        this.tradingLimitedBelow = builder.tradingLimitedBelow;
        this.tradingEstablishedFrom = builder.tradingEstablishedFrom;
        this.expiryUrgentDays = builder.expiryUrgentDays;
        this.expirySoonDays = builder.expirySoonDays;
        this.utilizationLowMax = builder.utilizationLowMax;
        this.utilizationHighMin = builder.utilizationHighMin;
        this.claimsRatioElevated = builder.claimsRatioElevated;
        this.claimsRatioSevere = builder.claimsRatioSevere;
        this.claimsCountSevere = builder.claimsCountSevere;
        this.changeEpsilon = builder.changeEpsilon;
    }

    /// Returns thresholds with every default value.
    ///
    /// @return default thresholds, never null
    public static FeatureThresholds defaults() {
        return builder().build();
    }

    /// Debtor days at or below this value are `SHORT`.
    public double getDebtorDaysShortMax() {
        return debtorDaysShortMax;
    }

    /// Debtor days above this value are `LONG`.
    public double getDebtorDaysLongMin() {
        return debtorDaysLongMin;
    }

    /// Years trading below this value are `LIMITED`.
    public double getTradingLimitedBelow() {
        return tradingLimitedBelow;
    }

    /// Years trading at or above this value are `ESTABLISHED`.
    public double getTradingEstablishedFrom() {
        return tradingEstablishedFrom;
    }

    /// Days to expiry at or below this value are `URGENT`.
    public double getExpiryUrgentDays() {
        return expiryUrgentDays;
    }

    /// Days to expiry at or below this value (and above urgent) are `SOON`.
    public double getExpirySoonDays() {
        return expirySoonDays;
    }

    /// Utilisation at or below this value is `LOW`.
    public double getUtilizationLowMax() {
        return utilizationLowMax;
    }

    /// Utilisation at or above this value is `HIGH`.
    public double getUtilizationHighMin() {
        return utilizationHighMin;
    }

    /// Claims ratio at or above this value is at least `ELEVATED`.
    public double getClaimsRatioElevated() {
        return claimsRatioElevated;
    }

    /// Claims ratio at or above this value is `SEVERE`.
    public double getClaimsRatioSevere() {
        return claimsRatioSevere;
    }

    /// Claim count at or above this value is `SEVERE`.
    public int getClaimsCountSevere() {
        return claimsCountSevere;
    }

    /// Requested changes within `±epsilon` are `FLAT`.
    public double getChangeEpsilon() {
        return changeEpsilon;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link FeatureThresholds}; unset values keep their defaults.
    public static final class Builder {
        private double debtorDaysShortMax = 60;
        private double debtorDaysLongMin = 120;
        private double tradingLimitedBelow = 2;
        private double tradingEstablishedFrom = 10;
        private double expiryUrgentDays = 30;
        private double expirySoonDays = 90;
        private double utilizationLowMax = 0.3;
        private double utilizationHighMin = 0.8;
        private double claimsRatioElevated = 1.5;
        private double claimsRatioSevere = 3.0;
        private int claimsCountSevere = 5;
        private double changeEpsilon = 0.1;

        private Builder() {}

        public Builder debtorDaysShortMax(double value) {
            this.debtorDaysShortMax = value;
            return this;
        }

        public Builder debtorDaysLongMin(double value) {
            this.debtorDaysLongMin = value;
            return this;
        }

        public Builder tradingLimitedBelow(double value) {
            this.tradingLimitedBelow = value;
            return this;
        }

        public Builder tradingEstablishedFrom(double value) {
            this.tradingEstablishedFrom = value;
            return this;
        }

        public Builder expiryUrgentDays(double value) {
            this.expiryUrgentDays = value;
            return this;
        }

        public Builder expirySoonDays(double value) {
            this.expirySoonDays = value;
            return this;
        }

        public Builder utilizationLowMax(double value) {
            this.utilizationLowMax = value;
            return this;
        }

        public Builder utilizationHighMin(double value) {
            this.utilizationHighMin = value;
            return this;
        }

        public Builder claimsRatioElevated(double value) {
            this.claimsRatioElevated = value;
            return this;
        }

        public Builder claimsRatioSevere(double value) {
            this.claimsRatioSevere = value;
            return this;
        }

        public Builder claimsCountSevere(int value) {
            this.claimsCountSevere = value;
            return this;
        }

        public Builder changeEpsilon(double value) {
            this.changeEpsilon = value;
            return this;
        }

        public FeatureThresholds build() {
            return new FeatureThresholds(this);
        }
    }
}
