package io.creditx.core;

import io.creditx.core.batch.ImportanceKey;
import java.util.Locale;
import java.util.Properties;

/// Configuration options for the underwriting engine environment.
///
/// Controls batch parallelism and how feature importance is keyed. Weight sets themselves are
/// not configured here; they are loaded into the {@link io.creditx.core.config.WeightsConfigStore}.
///
/// ### Default Values
/// - `parallelism`: `1` (records scored on the calling thread)
/// - `parallelThreshold`: `64` (smallest batch that fans out when parallelism is above 1)
/// - `importanceKey`: `RULE_ID`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link CreditxFactory}. Do not modify after environment creation.
///
/// @see CreditxFactory#createEnvironment(CreditxConfig)
/// @see Builder
public class CreditxConfig {

    public static final String PARALLELISM_PROPERTY = "creditx.parallelism";
    public static final String PARALLEL_THRESHOLD_PROPERTY = "creditx.parallel-threshold";
    public static final String IMPORTANCE_KEY_PROPERTY = "creditx.importance-key";

    private int parallelism = 1;
    private int parallelThreshold = 64;
    private ImportanceKey importanceKey = ImportanceKey.RULE_ID;

    /// Creates a configuration with default values.
    public CreditxConfig() {}

    /// Reads configuration from properties; absent keys keep their defaults.
    ///
    /// Recognised keys: `creditx.parallelism`, `creditx.parallel-threshold` and
    /// `creditx.importance-key` (`rule_id` or `reason`, case-insensitive).
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a present value cannot be parsed or is out of range
    public static CreditxConfig fromProperties(Properties properties) {
        CreditxConfig config = new CreditxConfig();

        String parallelism = properties.getProperty(PARALLELISM_PROPERTY);
        if (parallelism != null) {
            config.setParallelism(parseInt(PARALLELISM_PROPERTY, parallelism));
        }
        String threshold = properties.getProperty(PARALLEL_THRESHOLD_PROPERTY);
        if (threshold != null) {
            config.setParallelThreshold(parseInt(PARALLEL_THRESHOLD_PROPERTY, threshold));
        }
        String importanceKey = properties.getProperty(IMPORTANCE_KEY_PROPERTY);
        if (importanceKey != null) {
            try {
                config.setImportanceKey(
                        ImportanceKey.valueOf(importanceKey.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        IMPORTANCE_KEY_PROPERTY + " must be rule_id or reason: " + importanceKey,
                        e);
            }
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    /// Returns the number of worker threads used for large batches.
    ///
    /// @return worker count, `1` means no thread pool is created
    public int getParallelism() {
        return parallelism;
    }

    /// Sets the number of worker threads used for large batches.
    ///
    /// @param parallelism worker count, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /// Returns the smallest batch that fans out to the worker pool.
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /// Sets the smallest batch that fans out to the worker pool.
    ///
    /// @param parallelThreshold batch size, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setParallelThreshold(int parallelThreshold) {
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException(
                    "parallelThreshold must be >= 1: " + parallelThreshold);
        }
        this.parallelThreshold = parallelThreshold;
    }

    /// Returns how feature-importance counts are keyed.
    ///
    /// @return importance key, never null
    public ImportanceKey getImportanceKey() {
        return importanceKey;
    }

    public void setImportanceKey(ImportanceKey importanceKey) {
        if (importanceKey == null) {
            throw new IllegalArgumentException("importanceKey must not be null");
        }
        this.importanceKey = importanceKey;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link CreditxConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final CreditxConfig config = new CreditxConfig();

        public Builder parallelism(int parallelism) {
            config.setParallelism(parallelism);
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            config.setParallelThreshold(parallelThreshold);
            return this;
        }

        public Builder importanceKey(ImportanceKey importanceKey) {
            config.setImportanceKey(importanceKey);
            return this;
        }

        /// Builds and returns the configured {@link CreditxConfig} instance.
        ///
        /// @return the configured instance, never null
        public CreditxConfig build() {
            return config;
        }
    }
}
