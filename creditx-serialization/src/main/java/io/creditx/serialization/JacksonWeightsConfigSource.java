package io.creditx.serialization;

import io.creditx.core.config.ConfigException;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.config.WeightsConfigSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/// {@link WeightsConfigSource} reading a JSON or YAML document from a file, the classpath or
/// an in-memory string.
///
/// The document is re-read on every {@link #load()}, so reloading a file source picks up edits
/// made since the last reload.
///
/// {@snippet :
/// store.reload(JacksonWeightsConfigSource.ofPath(Path.of("/etc/creditx/weights.yaml")));
/// store.reload(JacksonWeightsConfigSource.defaults());
/// }
public final class JacksonWeightsConfigSource implements WeightsConfigSource {

    /// Classpath location of the bundled weights.
    public static final String DEFAULT_RESOURCE = "/io/creditx/serialization/default-weights.yaml";

    /// Document format.
    public enum Format {
        JSON,
        YAML
    }

    @FunctionalInterface
    private interface ContentReader {
        String read() throws IOException;
    }

    private final String description;
    private final Format format;
    private final ContentReader reader;

    private JacksonWeightsConfigSource(String description, Format format, ContentReader reader) {
        this.description = description;
        this.format = format;
        this.reader = reader;
    }

    /// Reads from a file; `.json` files are JSON, `.yaml` and `.yml` files are YAML.
    ///
    /// @param path document path, not null
    /// @return source, never null
    /// @throws IllegalArgumentException if the extension is not recognised
    public static JacksonWeightsConfigSource ofPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return ofPath(path, formatOf(path.getFileName().toString()));
    }

    /// Reads from a file in the given format.
    ///
    /// @param path document path, not null
    /// @param format document format, not null
    /// @return source, never null
    public static JacksonWeightsConfigSource ofPath(Path path, Format format) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(format, "format must not be null");
        return new JacksonWeightsConfigSource(
                "file " + path, format, () -> Files.readString(path, StandardCharsets.UTF_8));
    }

    /// Reads from a classpath resource; the format follows the resource extension.
    ///
    /// @param resource absolute resource name such as `/weights/prod.yaml`, not null
    /// @return source, never null
    /// @throws IllegalArgumentException if the extension is not recognised
    public static JacksonWeightsConfigSource ofClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        return new JacksonWeightsConfigSource(
                "classpath " + resource,
                formatOf(resource),
                () -> {
                    try (InputStream in =
                            JacksonWeightsConfigSource.class.getResourceAsStream(resource)) {
                        if (in == null) {
                            throw new IOException("resource not found");
                        }
                        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                    }
                });
    }

    /// Reads from an in-memory document.
    ///
    /// @param content document text, not null
    /// @param format document format, not null
    /// @return source, never null
    public static JacksonWeightsConfigSource ofString(String content, Format format) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
        return new JacksonWeightsConfigSource(
                "inline " + format.name().toLowerCase(Locale.ROOT), format, () -> content);
    }

    /// Returns a source for the weights bundled with this module.
    ///
    /// @return source for {@link #DEFAULT_RESOURCE}, never null
    public static JacksonWeightsConfigSource defaults() {
        return ofClasspath(DEFAULT_RESOURCE);
    }

    @Override
    public WeightsConfig load() throws ConfigException {
        String content;
        try {
            content = reader.read();
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + description + ": " + e.getMessage(), e);
        }
        return format == Format.JSON
                ? WeightsConfigSerializer.fromJson(content)
                : WeightsConfigSerializer.fromYaml(content);
    }

    @Override
    public String describe() {
        return description;
    }

    /// Returns the document format.
    public Format format() {
        return format;
    }

    private static Format formatOf(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return Format.JSON;
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return Format.YAML;
        }
        throw new IllegalArgumentException(
                "Cannot infer weights format from '" + name + "'; expected .json, .yaml or .yml");
    }
}
