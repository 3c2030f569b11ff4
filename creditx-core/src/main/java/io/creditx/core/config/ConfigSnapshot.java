package io.creditx.core.config;

import java.time.Instant;
import java.util.Objects;

/// Validated weights configuration together with the moment it became active.
///
/// Batches capture one snapshot at entry and use it throughout, so a concurrent reload never
/// mixes versions within a batch.
///
/// @param config validated configuration, not null
/// @param loadedAt activation time, not null
public record ConfigSnapshot(WeightsConfig config, Instant loadedAt) {

    public ConfigSnapshot {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(loadedAt, "loadedAt must not be null");
    }

    /// Returns the configuration version.
    public String version() {
        return config.getVersion();
    }

    /// Returns the descriptor exposed to config admins.
    public SnapshotDescriptor descriptor() {
        return new SnapshotDescriptor(config.getVersion(), loadedAt);
    }
}
