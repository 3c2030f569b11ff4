package io.creditx.core.config;

import java.time.Instant;

/// Identity of the active weights snapshot, for inspection by config admins.
///
/// @param version configuration version, not null
/// @param loadedAt when the snapshot became active, not null
public record SnapshotDescriptor(String version, Instant loadedAt) {}
