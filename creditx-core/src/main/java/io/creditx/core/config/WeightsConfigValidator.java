package io.creditx.core.config;

import io.creditx.core.engine.Operation;
import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureType;
import io.creditx.core.record.RecordKind;
import io.creditx.core.record.Sector;
import io.creditx.core.rule.CurveRule;
import io.creditx.core.rule.FlagRule;
import io.creditx.core.rule.MembershipRule;
import io.creditx.core.rule.ReasonTemplate;
import io.creditx.core.rule.Rule;
import io.creditx.core.rule.RuleSet;
import io.creditx.core.rule.ThresholdRule;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Validates a {@link WeightsConfig} before it may become the active snapshot.
///
/// All checks run at reload time so that scoring a record can never fail because of a
/// configuration mistake. Every problem is collected; the caller receives them together in
/// one {@link ConfigException}.
///
/// ### Checks
/// - non-blank version
/// - base rate for every sector, non-negative
/// - coverage limits within `[0, 1]`
/// - curves: finite points, strictly ascending `x`
/// - threshold ordering (see {@link FeatureThresholds})
/// - rule sets: unique non-blank ids, feature produced for the operation's record kind,
///   feature type matching the rule kind, closed-vocabulary membership values, finite weights
///   within the operation's range, reason placeholders bound to known features
/// - bands: unique codes, non-empty intervals, ascending, contiguous
/// - pricing bounds: `0 <= min <= max`
///
/// @implNote Stateless and thread-safe.
public final class WeightsConfigValidator {

    private WeightsConfigValidator() {}

    /// Validates a configuration.
    ///
    /// @param config configuration to check, not null
    /// @throws ConfigException listing every problem found
    public static void validate(WeightsConfig config) throws ConfigException {
        List<String> problems = problems(config);
        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
    }

    /// Collects every problem in a configuration.
    ///
    /// @param config configuration to check, not null
    /// @return problems in check order, empty if the configuration is valid
    public static List<String> problems(WeightsConfig config) {
        List<String> problems = new ArrayList<>();

        if (config.getVersion().isBlank()) {
            problems.add("version must be a non-empty string");
        }
        checkSectors(config, problems);
        checkCurve("hit_rate_curve", config.getHitRateCurve(), problems);
        checkThresholds(config.getThresholds(), problems);
        for (Operation operation : Operation.values()) {
            checkRuleSet(operation, config.rulesFor(operation), problems);
        }
        checkBands(config.getBands(), problems);
        checkBounds(config.getPricingBounds(), problems);

        return problems;
    }

    private static void checkSectors(WeightsConfig config, List<String> problems) {
        Map<Sector, Integer> baseRates = config.getSectorBaseRates();
        for (Sector sector : Sector.values()) {
            Integer rate = baseRates.get(sector);
            if (rate == null) {
                problems.add("sector_base_rates is missing sector " + sector.label());
            } else if (rate < 0) {
                problems.add("sector_base_rates." + sector.label() + " must be >= 0");
            }
        }
        config.getSectorCoverageLimits()
                .forEach(
                        (sector, limit) -> {
                            if (limit == null || !(limit >= 0.0 && limit <= 1.0)) {
                                problems.add(
                                        "sector_coverage_limits."
                                                + sector.label()
                                                + " must be within [0, 1]");
                            }
                        });
    }

    private static void checkCurve(String path, ScoreCurve curve, List<String> problems) {
        List<CurvePoint> points = curve.points();
        for (int i = 0; i < points.size(); i++) {
            CurvePoint point = points.get(i);
            if (!Double.isFinite(point.x()) || !Double.isFinite(point.y())) {
                problems.add(path + "[" + i + "] must have finite coordinates");
            }
            if (i > 0 && !(point.x() > points.get(i - 1).x())) {
                problems.add(path + " x values must be strictly ascending at index " + i);
            }
        }
    }

    private static void checkThresholds(FeatureThresholds t, List<String> problems) {
        double[] values = {
            t.getDebtorDaysShortMax(),
            t.getDebtorDaysLongMin(),
            t.getTradingLimitedBelow(),
            t.getTradingEstablishedFrom(),
            t.getExpiryUrgentDays(),
            t.getExpirySoonDays(),
            t.getUtilizationLowMax(),
            t.getUtilizationHighMin(),
            t.getClaimsRatioElevated(),
            t.getClaimsRatioSevere(),
            t.getChangeEpsilon()
        };
        for (double value : values) {
            if (!Double.isFinite(value) || value < 0) {
                problems.add("thresholds must be finite and non-negative");
                break;
            }
        }
        requireOrdered(
                t.getDebtorDaysShortMax(),
                t.getDebtorDaysLongMin(),
                "debtor_days_short_max",
                "debtor_days_long_min",
                problems);
        requireOrdered(
                t.getTradingLimitedBelow(),
                t.getTradingEstablishedFrom(),
                "trading_limited_below",
                "trading_established_from",
                problems);
        requireOrdered(
                t.getExpiryUrgentDays(),
                t.getExpirySoonDays(),
                "expiry_urgent_days",
                "expiry_soon_days",
                problems);
        requireOrdered(
                t.getUtilizationLowMax(),
                t.getUtilizationHighMin(),
                "utilization_low_max",
                "utilization_high_min",
                problems);
        requireOrdered(
                t.getClaimsRatioElevated(),
                t.getClaimsRatioSevere(),
                "claims_ratio_elevated",
                "claims_ratio_severe",
                problems);
        if (t.getClaimsCountSevere() < 1) {
            problems.add("thresholds.claims_count_severe must be >= 1");
        }
    }

    private static void requireOrdered(
            double low, double high, String lowName, String highName, List<String> problems) {
        if (low > high) {
            problems.add("thresholds." + lowName + " must not exceed thresholds." + highName);
        }
    }

    private static void checkRuleSet(Operation operation, RuleSet ruleSet, List<String> problems) {
        Set<String> seen = new HashSet<>();
        RecordKind kind = operation.recordKind();

        for (int i = 0; i < ruleSet.size(); i++) {
            Rule rule = ruleSet.rules().get(i);
            String path = operation.ruleSetKey() + "[" + i + "]";

            if (rule.id().isBlank()) {
                problems.add(path + " has a blank id");
            } else if (!seen.add(rule.id())) {
                problems.add(path + " duplicates rule id '" + rule.id() + "'");
            }
            path = operation.ruleSetKey() + "." + rule.id();

            Feature feature = rule.feature();
            if (!feature.appliesTo(kind)) {
                problems.add(
                        path
                                + " references feature '"
                                + feature.key()
                                + "' which is not extracted for "
                                + kind
                                + " records");
            }
            FeatureType expected = expectedType(rule);
            if (feature.type() != expected) {
                problems.add(
                        path
                                + " is a "
                                + rule.type()
                                + " rule and needs a "
                                + expected
                                + " feature, but '"
                                + feature.key()
                                + "' is "
                                + feature.type());
            }

            double weight = rule.weight();
            if (!Double.isFinite(weight) || Math.abs(weight) > operation.maxAbsWeight()) {
                problems.add(
                        path
                                + " weight "
                                + weight
                                + " is outside [-"
                                + ReasonTemplate.formatNumber(operation.maxAbsWeight())
                                + ", "
                                + ReasonTemplate.formatNumber(operation.maxAbsWeight())
                                + "]");
            }

            checkRuleParameters(rule, path, problems);
            checkTemplate(rule.reason(), kind, path, problems);
        }
    }

    private static FeatureType expectedType(Rule rule) {
        if (rule instanceof FlagRule) {
            return FeatureType.FLAG;
        }
        if (rule instanceof MembershipRule) {
            return FeatureType.CATEGORY;
        }
        return FeatureType.NUMERIC;
    }

    private static void checkRuleParameters(Rule rule, String path, List<String> problems) {
        if (rule instanceof ThresholdRule threshold) {
            if (!Double.isFinite(threshold.threshold())) {
                problems.add(path + " threshold must be finite");
            }
        } else if (rule instanceof MembershipRule membership) {
            if (membership.values().isEmpty()) {
                problems.add(path + " needs at least one value");
            }
            List<String> vocabulary = membership.feature().vocabulary();
            if (!vocabulary.isEmpty()) {
                for (String value : membership.values()) {
                    if (!vocabulary.contains(value)) {
                        problems.add(
                                path
                                        + " value '"
                                        + value
                                        + "' is not one of "
                                        + vocabulary);
                    }
                }
            }
        } else if (rule instanceof CurveRule curveRule) {
            checkCurve(path + ".curve", curveRule.curve(), problems);
            for (CurvePoint point : curveRule.curve().points()) {
                if (Math.abs(point.y()) > 1.0) {
                    problems.add(path + ".curve values must be within [-1, 1]");
                    break;
                }
            }
        }
    }

    private static void checkTemplate(
            ReasonTemplate template, RecordKind kind, String path, List<String> problems) {
        for (String token : template.placeholders()) {
            if (ReasonTemplate.WEIGHT_TOKEN.equals(token)) {
                continue;
            }
            Optional<Feature> feature = Feature.fromKey(token);
            if (feature.isEmpty()) {
                problems.add(path + " reason references unknown placeholder {" + token + "}");
            } else if (!feature.get().appliesTo(kind)) {
                problems.add(
                        path
                                + " reason placeholder {"
                                + token
                                + "} is not extracted for "
                                + kind
                                + " records");
            }
        }
    }

    private static void checkBands(BandTable table, List<String> problems) {
        List<Band> bands = table.bands();
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < bands.size(); i++) {
            Band band = bands.get(i);
            if (band.code().isBlank()) {
                problems.add("bands[" + i + "] has a blank code");
            } else if (!codes.add(band.code())) {
                problems.add("bands[" + i + "] duplicates band code '" + band.code() + "'");
            }
            if (band.lowerBpsInclusive() >= band.upperBpsExclusive()) {
                problems.add("bands." + band.code() + " has an empty interval");
            }
            if (i > 0) {
                Band previous = bands.get(i - 1);
                if (band.lowerBpsInclusive() < previous.upperBpsExclusive()) {
                    problems.add(
                            "bands."
                                    + band.code()
                                    + " overlaps or precedes bands."
                                    + previous.code());
                } else if (band.lowerBpsInclusive() > previous.upperBpsExclusive()) {
                    problems.add(
                            "bands leave a gap between "
                                    + previous.code()
                                    + " and "
                                    + band.code());
                }
            }
        }
    }

    private static void checkBounds(PricingBounds bounds, List<String> problems) {
        if (bounds == null) {
            return;
        }
        if (bounds.minRateBps() < 0) {
            problems.add("pricing_bounds.min_rate must be >= 0");
        }
        if (bounds.minRateBps() > bounds.maxRateBps()) {
            problems.add("pricing_bounds.min_rate must not exceed pricing_bounds.max_rate");
        }
    }
}
