package io.creditx.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.creditx.core.config.CurvePoint;
import io.creditx.core.config.ScoreCurve;
import io.creditx.core.rule.CurveRule;
import io.creditx.core.rule.FlagRule;
import io.creditx.core.rule.MembershipRule;
import io.creditx.core.rule.Rule;
import io.creditx.core.rule.ThresholdRule;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `Rule` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted shape per subtype, after the common `id`, `type`, `feature`:
/// - **`ThresholdRule`**: `operator` (symbol), `threshold`
/// - **`FlagRule`**: `expected`
/// - **`MembershipRule`**: `values` (list of strings)
/// - **`CurveRule`**: `curve` (list of `{x, y}`)
///
/// followed by `weight` and `reason` (template source, placeholders unrendered).
///
/// @implNote Package-private. Registered by {@link CreditxJacksonModule}.
/// @see RuleDeserializer for the inverse operation
class RuleSerializer extends StdSerializer<Rule> {

    @Serial private static final long serialVersionUID = -4187760270931578118L;

    RuleSerializer() {
        super(Rule.class);
    }

    @Override
    public void serialize(Rule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", rule.id());
        gen.writeStringField("type", rule.type());
        gen.writeStringField("feature", rule.feature().key());

        if (rule instanceof ThresholdRule t) {
            gen.writeStringField("operator", t.operator().symbol());
            gen.writeNumberField("threshold", t.threshold());
        } else if (rule instanceof FlagRule f) {
            gen.writeBooleanField("expected", f.expected());
        } else if (rule instanceof MembershipRule m) {
            gen.writeArrayFieldStart("values");
            for (String value : m.values()) {
                gen.writeString(value);
            }
            gen.writeEndArray();
        } else if (rule instanceof CurveRule c) {
            gen.writeFieldName("curve");
            writeCurve(c.curve(), gen);
        }

        gen.writeNumberField("weight", rule.weight());
        gen.writeStringField("reason", rule.reason().source());
        gen.writeEndObject();
    }

    static void writeCurve(ScoreCurve curve, JsonGenerator gen) throws IOException {
        gen.writeStartArray();
        for (CurvePoint point : curve.points()) {
            gen.writeStartObject();
            gen.writeNumberField("x", point.x());
            gen.writeNumberField("y", point.y());
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
