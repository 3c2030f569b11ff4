package io.creditx.core.config;

import io.creditx.core.engine.Operation;
import io.creditx.core.record.Sector;
import io.creditx.core.rule.RuleSet;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/// Immutable, versioned bundle of weights, thresholds and band definitions.
///
/// One instance is one snapshot: it is built once, validated by {@link WeightsConfigValidator},
/// and then only replaced as a whole by {@link WeightsConfigStore#reload}.
///
/// ### Contents
/// - sector base rates in basis points (every {@link Sector} required)
/// - optional sector coverage limits (missing sectors default to `1.0`)
/// - broker hit-rate quality curve
/// - feature bucket thresholds
/// - triage, renewal and pricing rule sets, in evaluation order
/// - risk band table
/// - optional pricing floor/ceiling
///
/// @implNote Immutable and thread-safe after construction. Maps are copied into unmodifiable
/// {@link EnumMap}s.
///
/// @see WeightsConfigValidator for the validation rules
public final class WeightsConfig {

    private final String version;
    private final Map<Sector, Integer> sectorBaseRates;
    private final Map<Sector, Double> sectorCoverageLimits;
    private final ScoreCurve hitRateCurve;
    private final FeatureThresholds thresholds;
    private final RuleSet triageRules;
    private final RuleSet renewalRules;
    private final RuleSet pricingRules;
    private final BandTable bands;
    private final PricingBounds pricingBounds;

    private WeightsConfig(Builder builder) {
        this.version = Objects.requireNonNull(builder.version, "version required");
        this.sectorBaseRates = Collections.unmodifiableMap(copy(builder.sectorBaseRates));
        this.sectorCoverageLimits = Collections.unmodifiableMap(copy(builder.sectorCoverageLimits));
        this.hitRateCurve = Objects.requireNonNull(builder.hitRateCurve, "hitRateCurve required");
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds required");
        this.triageRules = Objects.requireNonNull(builder.triageRules, "triageRules required");
        this.renewalRules = Objects.requireNonNull(builder.renewalRules, "renewalRules required");
        this.pricingRules = Objects.requireNonNull(builder.pricingRules, "pricingRules required");
        this.bands = Objects.requireNonNull(builder.bands, "bands required");
        this.pricingBounds = builder.pricingBounds;
    }

    private static <V> Map<Sector, V> copy(Map<Sector, V> source) {
        Map<Sector, V> copy = new EnumMap<>(Sector.class);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    /// Returns the configuration version reported with every batch result.
    public String getVersion() {
        return version;
    }

    /// Returns the base rate per sector in basis points.
    public Map<Sector, Integer> getSectorBaseRates() {
        return sectorBaseRates;
    }

    /// Returns the base rate for a sector.
    ///
    /// @param sector sector to look up, may be null
    /// @return base rate, or empty if the sector has none
    public OptionalInt baseRateFor(Sector sector) {
        Integer rate = sector != null ? sectorBaseRates.get(sector) : null;
        return rate != null ? OptionalInt.of(rate) : OptionalInt.empty();
    }

    /// Returns the configured coverage limits per sector.
    public Map<Sector, Double> getSectorCoverageLimits() {
        return sectorCoverageLimits;
    }

    /// Returns the maximum requested coverage share for a sector.
    ///
    /// @param sector sector to look up, not null
    /// @return configured limit, or `1.0` if none is configured
    public double coverageLimitFor(Sector sector) {
        return sectorCoverageLimits.getOrDefault(sector, 1.0);
    }

    public ScoreCurve getHitRateCurve() {
        return hitRateCurve;
    }

    public FeatureThresholds getThresholds() {
        return thresholds;
    }

    public RuleSet getTriageRules() {
        return triageRules;
    }

    public RuleSet getRenewalRules() {
        return renewalRules;
    }

    public RuleSet getPricingRules() {
        return pricingRules;
    }

    /// Returns the rule set evaluated by an operation.
    ///
    /// @param operation engine operation, not null
    /// @return rule set, never null
    public RuleSet rulesFor(Operation operation) {
        return switch (operation) {
            case TRIAGE -> triageRules;
            case RENEWAL_PRIORITY -> renewalRules;
            case PRICING -> pricingRules;
        };
    }

    public BandTable getBands() {
        return bands;
    }

    /// Returns the pricing floor/ceiling.
    ///
    /// @return bounds, or null if suggested rates are not clipped
    public PricingBounds getPricingBounds() {
        return pricingBounds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link WeightsConfig}.
    ///
    /// Required fields: `version`, `hitRateCurve`, `bands`. Rule sets default to empty and
    /// thresholds to {@link FeatureThresholds#defaults()}.
    public static final class Builder {
        private String version;
        private Map<Sector, Integer> sectorBaseRates = new EnumMap<>(Sector.class);
        private Map<Sector, Double> sectorCoverageLimits = new EnumMap<>(Sector.class);
        private ScoreCurve hitRateCurve;
        private FeatureThresholds thresholds = FeatureThresholds.defaults();
        private RuleSet triageRules = RuleSet.empty();
        private RuleSet renewalRules = RuleSet.empty();
        private RuleSet pricingRules = RuleSet.empty();
        private BandTable bands;
        private PricingBounds pricingBounds;

        private Builder() {}

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder sectorBaseRates(Map<Sector, Integer> sectorBaseRates) {
            this.sectorBaseRates = copy(sectorBaseRates);
            return this;
        }

        public Builder sectorBaseRate(Sector sector, int rateBps) {
            this.sectorBaseRates.put(sector, rateBps);
            return this;
        }

        public Builder sectorCoverageLimits(Map<Sector, Double> sectorCoverageLimits) {
            this.sectorCoverageLimits = copy(sectorCoverageLimits);
            return this;
        }

        public Builder sectorCoverageLimit(Sector sector, double limit) {
            this.sectorCoverageLimits.put(sector, limit);
            return this;
        }

        public Builder hitRateCurve(ScoreCurve hitRateCurve) {
            this.hitRateCurve = hitRateCurve;
            return this;
        }

        public Builder thresholds(FeatureThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder triageRules(RuleSet triageRules) {
            this.triageRules = triageRules;
            return this;
        }

        public Builder renewalRules(RuleSet renewalRules) {
            this.renewalRules = renewalRules;
            return this;
        }

        public Builder pricingRules(RuleSet pricingRules) {
            this.pricingRules = pricingRules;
            return this;
        }

        public Builder bands(BandTable bands) {
            this.bands = bands;
            return this;
        }

        public Builder pricingBounds(PricingBounds pricingBounds) {
            this.pricingBounds = pricingBounds;
            return this;
        }

        public WeightsConfig build() {
            return new WeightsConfig(this);
        }
    }
}
