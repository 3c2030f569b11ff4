package io.creditx.core.config;

/// Source of a weights configuration, such as a file, a classpath resource or a string.
///
/// Implementations parse the raw content into a {@link WeightsConfig}; semantic validation
/// happens afterwards in {@link WeightsConfigStore#reload}.
@FunctionalInterface
public interface WeightsConfigSource {

    /// Loads and parses a configuration.
    ///
    /// @return parsed configuration, never null
    /// @throws ConfigException if the content cannot be read or is structurally malformed
    WeightsConfig load() throws ConfigException;

    /// Describes where the configuration comes from, for logs.
    ///
    /// @return short description, never null
    default String describe() {
        return getClass().getSimpleName();
    }
}
