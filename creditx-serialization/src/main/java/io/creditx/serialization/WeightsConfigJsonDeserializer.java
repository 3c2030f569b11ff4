package io.creditx.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.creditx.core.config.Band;
import io.creditx.core.config.BandTable;
import io.creditx.core.config.FeatureThresholds;
import io.creditx.core.config.PricingBounds;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.engine.Operation;
import io.creditx.core.record.Sector;
import io.creditx.core.rule.Rule;
import io.creditx.core.rule.RuleSet;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Deserializes a complete weights document.
///
/// Top-level keys: `version`, `sector_base_rates`, `sector_coverage_limits`, `hit_rate_curve`,
/// `thresholds`, `triage_rules`, `renewal_rules`, `pricing_rules`, `bands`, `pricing_bounds`.
/// `version`, `sector_base_rates`, `hit_rate_curve` and `bands` are required; unknown keys are
/// ignored. Sector keys accept the display label or the constant name.
///
/// Only the document's shape is checked here. Semantic checks (missing sectors, band gaps,
/// rule/feature type mismatches) are left to the config validator, which reports all of them
/// at once.
///
/// @see WeightsConfigJsonSerializer for the inverse operation
class WeightsConfigJsonDeserializer extends StdDeserializer<WeightsConfig> {

    @Serial private static final long serialVersionUID = 6314470851762990412L;

    WeightsConfigJsonDeserializer() {
        super(WeightsConfig.class);
    }

    @Override
    public WeightsConfig deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Weights document must be a mapping");
        }
        try {
            return readConfig(root);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    private static WeightsConfig readConfig(JsonNode root) {
        String path = "weights";
        WeightsConfig.Builder builder =
                WeightsConfig.builder()
                        .version(JsonNodes.text(root, "version", path))
                        .hitRateCurve(
                                RuleDeserializer.readCurve(
                                        JsonNodes.required(root, "hit_rate_curve", path),
                                        "hit_rate_curve"));

        Map<Sector, Integer> baseRates = new EnumMap<>(Sector.class);
        forEachField(
                JsonNodes.object(root, "sector_base_rates", path),
                (sector, value) ->
                        baseRates.put(
                                sector,
                                JsonNodes.asInteger(
                                        value, "sector_base_rates." + sector.label())));
        builder.sectorBaseRates(baseRates);

        if (root.hasNonNull("sector_coverage_limits")) {
            Map<Sector, Double> limits = new EnumMap<>(Sector.class);
            forEachField(
                    JsonNodes.object(root, "sector_coverage_limits", path),
                    (sector, value) ->
                            limits.put(
                                    sector,
                                    JsonNodes.asNumber(
                                            value, "sector_coverage_limits." + sector.label())));
            builder.sectorCoverageLimits(limits);
        }

        if (root.hasNonNull("thresholds")) {
            builder.thresholds(readThresholds(JsonNodes.object(root, "thresholds", path)));
        }

        builder.triageRules(readRuleSet(root, Operation.TRIAGE))
                .renewalRules(readRuleSet(root, Operation.RENEWAL_PRIORITY))
                .pricingRules(readRuleSet(root, Operation.PRICING));

        List<Band> bands = new ArrayList<>();
        int i = 0;
        for (JsonNode band : JsonNodes.array(root, "bands", path)) {
            bands.add(readBand(band, "bands[" + i++ + "]"));
        }
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("bands must contain at least one band");
        }
        builder.bands(new BandTable(bands));

        if (root.hasNonNull("pricing_bounds")) {
            JsonNode bounds = JsonNodes.object(root, "pricing_bounds", path);
            builder.pricingBounds(
                    new PricingBounds(
                            JsonNodes.integer(bounds, "min_rate", "pricing_bounds"),
                            JsonNodes.integer(bounds, "max_rate", "pricing_bounds")));
        }

        return builder.build();
    }

    private static RuleSet readRuleSet(JsonNode root, Operation operation) {
        String key = operation.ruleSetKey();
        if (!root.hasNonNull(key)) {
            return RuleSet.empty();
        }
        List<Rule> rules = new ArrayList<>();
        int i = 0;
        for (JsonNode rule : JsonNodes.array(root, key, "weights")) {
            rules.add(RuleDeserializer.readRule(rule, key + "[" + i++ + "]"));
        }
        return new RuleSet(rules);
    }

    private static Band readBand(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(path + " must be a mapping");
        }
        String code = JsonNodes.text(node, "code", path);
        return new Band(
                code,
                JsonNodes.optionalText(node, "label", code),
                JsonNodes.optionalText(node, "description", ""),
                JsonNodes.integer(node, "lower", path),
                JsonNodes.integer(node, "upper", path));
    }

    private static FeatureThresholds readThresholds(JsonNode node) {
        FeatureThresholds.Builder builder = FeatureThresholds.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = "thresholds." + field.getKey();
            JsonNode value = field.getValue();
            switch (field.getKey()) {
                case "debtor_days_short_max" ->
                        builder.debtorDaysShortMax(JsonNodes.asNumber(value, path));
                case "debtor_days_long_min" ->
                        builder.debtorDaysLongMin(JsonNodes.asNumber(value, path));
                case "trading_limited_below" ->
                        builder.tradingLimitedBelow(JsonNodes.asNumber(value, path));
                case "trading_established_from" ->
                        builder.tradingEstablishedFrom(JsonNodes.asNumber(value, path));
                case "expiry_urgent_days" ->
                        builder.expiryUrgentDays(JsonNodes.asNumber(value, path));
                case "expiry_soon_days" -> builder.expirySoonDays(JsonNodes.asNumber(value, path));
                case "utilization_low_max" ->
                        builder.utilizationLowMax(JsonNodes.asNumber(value, path));
                case "utilization_high_min" ->
                        builder.utilizationHighMin(JsonNodes.asNumber(value, path));
                case "claims_ratio_elevated" ->
                        builder.claimsRatioElevated(JsonNodes.asNumber(value, path));
                case "claims_ratio_severe" ->
                        builder.claimsRatioSevere(JsonNodes.asNumber(value, path));
                case "claims_count_severe" ->
                        builder.claimsCountSevere(JsonNodes.asInteger(value, path));
                case "change_epsilon" -> builder.changeEpsilon(JsonNodes.asNumber(value, path));
                default -> throw new IllegalArgumentException("Unknown threshold: " + path);
            }
        }
        return builder.build();
    }

    private static void forEachField(JsonNode node, SectorFieldConsumer consumer) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            consumer.accept(Sector.fromLabel(field.getKey()), field.getValue());
        }
    }

    @FunctionalInterface
    private interface SectorFieldConsumer {
        void accept(Sector sector, JsonNode value);
    }
}
