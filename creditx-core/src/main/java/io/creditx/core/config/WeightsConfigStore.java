package io.creditx.core.config;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/// Holds the active weights snapshot and replaces it atomically on reload.
///
/// Readers call {@link #getActive()} once per batch and keep the returned snapshot for the
/// whole batch. A reload builds and validates the new configuration completely before a single
/// reference swap publishes it, so readers never observe a partial update and batches already
/// in flight finish on the snapshot they captured.
///
/// ### Contracts
/// - **Postcondition** (`reload` success): the new snapshot is active
/// - **Postcondition** (`reload` failure): the previous snapshot, including its `loadedAt`,
///   is still active
///
/// @implNote Thread-safe. Reads are a single volatile load and never block; no lock is held
/// across a batch.
///
/// @see WeightsConfigValidator for what a reload rejects
public final class WeightsConfigStore {

    private static final Logger logger = Logger.getLogger(WeightsConfigStore.class.getName());

    private final AtomicReference<ConfigSnapshot> active = new AtomicReference<>();
    private final Clock clock;

    /// Creates an empty store using the system UTC clock.
    public WeightsConfigStore() {
        this(Clock.systemUTC());
    }

    /// Creates an empty store.
    ///
    /// @param clock source of `loadedAt` timestamps, not null
    public WeightsConfigStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Returns the active snapshot.
    ///
    /// @return the last successfully loaded snapshot, never null
    /// @throws NoActiveConfigException if no configuration has been loaded yet
    public ConfigSnapshot getActive() throws NoActiveConfigException {
        ConfigSnapshot snapshot = active.get();
        if (snapshot == null) {
            throw new NoActiveConfigException(
                    "No weights configuration loaded; call reload() before scoring");
        }
        return snapshot;
    }

    /// Returns the version and activation time of the active snapshot.
    ///
    /// @return descriptor, or empty before the first successful load
    public Optional<SnapshotDescriptor> describe() {
        return Optional.ofNullable(active.get()).map(ConfigSnapshot::descriptor);
    }

    /// Loads, validates and activates a configuration.
    ///
    /// @apiNote **Side effects**: replaces the active snapshot on success; logs the outcome
    ///
    /// @param source configuration source, not null
    /// @return the newly active configuration, never null
    /// @throws ConfigException if the source fails or the configuration is invalid; the
    ///     active snapshot is left unchanged
    public WeightsConfig reload(WeightsConfigSource source) throws ConfigException {
        Objects.requireNonNull(source, "source must not be null");

        WeightsConfig config;
        try {
            config = source.load();
            if (config == null) {
                throw new ConfigException(source.describe() + " produced no configuration");
            }
            WeightsConfigValidator.validate(config);
        } catch (ConfigException e) {
            logger.warning(
                    "Rejected weights reload from " + source.describe() + ": " + e.getMessage());
            throw e;
        }

        return activate(config);
    }

    /// Validates and activates an already-built configuration.
    ///
    /// @param config configuration, not null
    /// @return the newly active configuration, never null
    /// @throws ConfigException if the configuration is invalid; the active snapshot is left
    ///     unchanged
    public WeightsConfig reload(WeightsConfig config) throws ConfigException {
        Objects.requireNonNull(config, "config must not be null");
        return reload(
                new WeightsConfigSource() {
                    @Override
                    public WeightsConfig load() {
                        return config;
                    }

                    @Override
                    public String describe() {
                        return "in-memory config " + config.getVersion();
                    }
                });
    }

    private WeightsConfig activate(WeightsConfig config) {
        ConfigSnapshot snapshot = new ConfigSnapshot(config, clock.instant());
        ConfigSnapshot previous = active.getAndSet(snapshot);

        logger.info(
                "Activated weights version "
                        + config.getVersion()
                        + (previous != null ? " (replacing " + previous.version() + ")" : "")
                        + " with "
                        + config.getTriageRules().size()
                        + " triage, "
                        + config.getRenewalRules().size()
                        + " renewal and "
                        + config.getPricingRules().size()
                        + " pricing rules");
        return config;
    }
}
