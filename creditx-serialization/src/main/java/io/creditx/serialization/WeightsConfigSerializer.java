package io.creditx.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.creditx.core.config.ConfigException;
import io.creditx.core.config.WeightsConfig;

/// Utility class for reading and writing weights documents as JSON or YAML.
///
/// ### Usage
/// {@snippet :
/// WeightsConfig config = WeightsConfigSerializer.fromYaml(yaml);
/// String json = WeightsConfigSerializer.toJson(config);
///
/// // Results and descriptors are plain records
/// String body = WeightsConfigSerializer.createMapper().writeValueAsString(batchResult);
/// }
///
/// Parsing checks the document shape only; pass the result to
/// {@link io.creditx.core.config.WeightsConfigStore#reload} to validate and activate it.
///
/// @implNote Thread-safe. Mappers are created per call via `createMapper()` and
/// `createYamlMapper()`; cache them for high-throughput use.
///
/// @see CreditxJacksonModule for the registered type handlers
public final class WeightsConfigSerializer {

    private WeightsConfigSerializer() {}

    /// Parses a JSON weights document.
    ///
    /// @param json JSON text, not null
    /// @return parsed configuration, never null
    /// @throws ConfigException if the document is malformed
    public static WeightsConfig fromJson(String json) throws ConfigException {
        return read(createMapper(), json, "JSON");
    }

    /// Parses a YAML weights document.
    ///
    /// @param yaml YAML text, not null
    /// @return parsed configuration, never null
    /// @throws ConfigException if the document is malformed
    public static WeightsConfig fromYaml(String yaml) throws ConfigException {
        return read(createYamlMapper(), yaml, "YAML");
    }

    /// Writes a configuration as pretty-printed JSON.
    ///
    /// @param config configuration, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WeightsConfig config) {
        return write(createMapper(), config);
    }

    /// Writes a configuration as YAML.
    ///
    /// @param config configuration, not null
    /// @return YAML text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toYaml(WeightsConfig config) {
        return write(createYamlMapper(), config);
    }

    /// Creates an ObjectMapper configured for weights and result serialization.
    ///
    /// Registers:
    /// - `CreditxJacksonModule` for the weights document and rule hierarchy
    /// - `JavaTimeModule` for the `Instant` in snapshot descriptors
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return configure(new ObjectMapper());
    }

    /// Creates an ObjectMapper reading and writing YAML with the same configuration as
    /// {@link #createMapper()}.
    ///
    /// Number-like strings such as a `2024.10` version are written quoted so they read back
    /// as strings.
    ///
    /// @return configured YAML ObjectMapper, never null
    public static ObjectMapper createYamlMapper() {
        YAMLFactory factory =
                new YAMLFactory()
                        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS);
        return configure(new ObjectMapper(factory));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new CreditxJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static WeightsConfig read(ObjectMapper mapper, String content, String format)
            throws ConfigException {
        try {
            return mapper.readValue(content, WeightsConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(
                    "Malformed " + format + " weights document: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(ObjectMapper mapper, WeightsConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize weights " + config.getVersion() + ": " + e.getMessage(),
                    e);
        }
    }
}
