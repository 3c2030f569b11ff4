package io.creditx.serialization;

import com.fasterxml.jackson.databind.JsonNode;

/// Field accessors for tree-based deserializers.
///
/// Every accessor throws {@link IllegalArgumentException} naming the offending path; the
/// deserializers translate that into a Jackson mapping error at the document root.
final class JsonNodes {

    private JsonNodes() {}

    static JsonNode required(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException(path + " is missing required field '" + field + "'");
        }
        return value;
    }

    static String text(JsonNode node, String field, String path) {
        JsonNode value = required(node, field, path);
        if (!value.isTextual()) {
            throw new IllegalArgumentException(
                    path
                            + "."
                            + field
                            + " must be a string but was "
                            + value
                            + "; quote the value");
        }
        return value.textValue();
    }

    static String optionalText(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    static double number(JsonNode node, String field, String path) {
        return asNumber(required(node, field, path), path + "." + field);
    }

    static double asNumber(JsonNode value, String path) {
        if (!value.isNumber()) {
            throw new IllegalArgumentException(path + " must be a number but was " + value);
        }
        return value.doubleValue();
    }

    static int integer(JsonNode node, String field, String path) {
        return asInteger(required(node, field, path), path + "." + field);
    }

    static int asInteger(JsonNode value, String path) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(path + " must be an integer but was " + value);
        }
        return value.intValue();
    }

    static boolean flag(JsonNode node, String field, boolean fallback, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(path + "." + field + " must be true or false");
        }
        return value.booleanValue();
    }

    static JsonNode array(JsonNode node, String field, String path) {
        JsonNode value = required(node, field, path);
        if (!value.isArray()) {
            throw new IllegalArgumentException(path + "." + field + " must be a list");
        }
        return value;
    }

    static JsonNode object(JsonNode node, String field, String path) {
        JsonNode value = required(node, field, path);
        if (!value.isObject()) {
            throw new IllegalArgumentException(path + "." + field + " must be a mapping");
        }
        return value;
    }
}
