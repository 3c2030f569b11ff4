package io.creditx.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.creditx.core.config.CurvePoint;
import io.creditx.core.config.ScoreCurve;
import io.creditx.core.feature.Feature;
import io.creditx.core.rule.ComparisonOperator;
import io.creditx.core.rule.CurveRule;
import io.creditx.core.rule.FlagRule;
import io.creditx.core.rule.MembershipRule;
import io.creditx.core.rule.ReasonTemplate;
import io.creditx.core.rule.Rule;
import io.creditx.core.rule.ThresholdRule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes `Rule` variants based on the `type` discriminator field.
///
/// Features are resolved by their snake_case key; operators accept either the constant name
/// (`GTE`) or the symbol (`>=`). Type compatibility between a rule and its feature is left to
/// the config validator so that every such problem is reported together.
///
/// @see RuleSerializer for the inverse operation
class RuleDeserializer extends StdDeserializer<Rule> {

    @Serial private static final long serialVersionUID = 2740516382911264035L;

    RuleDeserializer() {
        super(Rule.class);
    }

    @Override
    public Rule deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return readRule(root, "rule");
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    /// Reads one rule from a tree node.
    ///
    /// @param node rule object, not null
    /// @param path location used in error messages, not null
    /// @return parsed rule, never null
    /// @throws IllegalArgumentException if the node is not a well-formed rule
    static Rule readRule(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(path + " must be a mapping");
        }
        String id = JsonNodes.text(node, "id", path);
        path = path + "(" + id + ")";

        String type = JsonNodes.text(node, "type", path);
        Feature feature = readFeature(JsonNodes.text(node, "feature", path));
        double weight = JsonNodes.number(node, "weight", path);
        ReasonTemplate reason = ReasonTemplate.of(JsonNodes.text(node, "reason", path));

        return switch (type) {
            case ThresholdRule.TYPE ->
                    new ThresholdRule(
                            id,
                            feature,
                            ComparisonOperator.parse(JsonNodes.text(node, "operator", path)),
                            JsonNodes.number(node, "threshold", path),
                            weight,
                            reason);
            case FlagRule.TYPE ->
                    new FlagRule(
                            id,
                            feature,
                            JsonNodes.flag(node, "expected", true, path),
                            weight,
                            reason);
            case MembershipRule.TYPE -> {
                List<String> values = new ArrayList<>();
                for (JsonNode value : JsonNodes.array(node, "values", path)) {
                    values.add(value.asText());
                }
                yield new MembershipRule(id, feature, values, weight, reason);
            }
            case CurveRule.TYPE ->
                    new CurveRule(
                            id,
                            feature,
                            readCurve(JsonNodes.required(node, "curve", path), path + ".curve"),
                            weight,
                            reason);
            default -> throw new IllegalArgumentException(path + " has unknown rule type: " + type);
        };
    }

    static Feature readFeature(String key) {
        return Feature.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown feature: " + key));
    }

    /// Reads a curve written either as `[{x: .., y: ..}, ...]` or as `[[x, y], ...]`.
    static ScoreCurve readCurve(JsonNode node, String path) {
        if (!node.isArray() || node.isEmpty()) {
            throw new IllegalArgumentException(path + " must be a non-empty list of points");
        }
        List<CurvePoint> points = new ArrayList<>();
        int i = 0;
        for (JsonNode point : node) {
            String pointPath = path + "[" + i++ + "]";
            if (point.isArray() && point.size() == 2) {
                points.add(
                        new CurvePoint(
                                JsonNodes.asNumber(point.get(0), pointPath),
                                JsonNodes.asNumber(point.get(1), pointPath)));
            } else if (point.isObject()) {
                points.add(
                        new CurvePoint(
                                JsonNodes.number(point, "x", pointPath),
                                JsonNodes.number(point, "y", pointPath)));
            } else {
                throw new IllegalArgumentException(
                        pointPath + " must be {x, y} or a two-element list");
            }
        }
        return new ScoreCurve(points);
    }
}
