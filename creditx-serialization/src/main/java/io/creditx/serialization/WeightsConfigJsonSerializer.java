package io.creditx.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.creditx.core.config.Band;
import io.creditx.core.config.FeatureThresholds;
import io.creditx.core.config.PricingBounds;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.engine.Operation;
import io.creditx.core.record.Sector;
import io.creditx.core.rule.Rule;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a {@link WeightsConfig} into the document shape read by
/// {@link WeightsConfigJsonDeserializer}.
///
/// Sectors are written by display label; thresholds are always written in full so that a
/// round-tripped document does not depend on the defaults of the reading side.
///
/// @implNote Package-private. Registered by {@link CreditxJacksonModule}.
class WeightsConfigJsonSerializer extends StdSerializer<WeightsConfig> {

    @Serial private static final long serialVersionUID = -2096334598164237721L;

    WeightsConfigJsonSerializer() {
        super(WeightsConfig.class);
    }

    @Override
    public void serialize(WeightsConfig config, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("version", config.getVersion());

        gen.writeObjectFieldStart("sector_base_rates");
        for (Map.Entry<Sector, Integer> entry : config.getSectorBaseRates().entrySet()) {
            gen.writeNumberField(entry.getKey().label(), entry.getValue());
        }
        gen.writeEndObject();

        if (!config.getSectorCoverageLimits().isEmpty()) {
            gen.writeObjectFieldStart("sector_coverage_limits");
            for (Map.Entry<Sector, Double> entry : config.getSectorCoverageLimits().entrySet()) {
                gen.writeNumberField(entry.getKey().label(), entry.getValue());
            }
            gen.writeEndObject();
        }

        gen.writeFieldName("hit_rate_curve");
        RuleSerializer.writeCurve(config.getHitRateCurve(), gen);

        writeThresholds(config.getThresholds(), gen);

        for (Operation operation : Operation.values()) {
            gen.writeArrayFieldStart(operation.ruleSetKey());
            for (Rule rule : config.rulesFor(operation).rules()) {
                gen.writeObject(rule);
            }
            gen.writeEndArray();
        }

        gen.writeArrayFieldStart("bands");
        for (Band band : config.getBands().bands()) {
            gen.writeStartObject();
            gen.writeStringField("code", band.code());
            gen.writeStringField("label", band.label());
            gen.writeStringField("description", band.description());
            gen.writeNumberField("lower", band.lowerBpsInclusive());
            gen.writeNumberField("upper", band.upperBpsExclusive());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        PricingBounds bounds = config.getPricingBounds();
        if (bounds != null) {
            gen.writeObjectFieldStart("pricing_bounds");
            gen.writeNumberField("min_rate", bounds.minRateBps());
            gen.writeNumberField("max_rate", bounds.maxRateBps());
            gen.writeEndObject();
        }

        gen.writeEndObject();
    }

    private static void writeThresholds(FeatureThresholds t, JsonGenerator gen)
            throws IOException {
        gen.writeObjectFieldStart("thresholds");
        gen.writeNumberField("debtor_days_short_max", t.getDebtorDaysShortMax());
        gen.writeNumberField("debtor_days_long_min", t.getDebtorDaysLongMin());
        gen.writeNumberField("trading_limited_below", t.getTradingLimitedBelow());
        gen.writeNumberField("trading_established_from", t.getTradingEstablishedFrom());
        gen.writeNumberField("expiry_urgent_days", t.getExpiryUrgentDays());
        gen.writeNumberField("expiry_soon_days", t.getExpirySoonDays());
        gen.writeNumberField("utilization_low_max", t.getUtilizationLowMax());
        gen.writeNumberField("utilization_high_min", t.getUtilizationHighMin());
        gen.writeNumberField("claims_ratio_elevated", t.getClaimsRatioElevated());
        gen.writeNumberField("claims_ratio_severe", t.getClaimsRatioSevere());
        gen.writeNumberField("claims_count_severe", t.getClaimsCountSevere());
        gen.writeNumberField("change_epsilon", t.getChangeEpsilon());
        gen.writeEndObject();
    }
}
