package io.creditx.core;

import io.creditx.core.batch.BatchAggregator;
import io.creditx.core.config.ConfigException;
import io.creditx.core.config.WeightsConfigSource;
import io.creditx.core.config.WeightsConfigStore;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring underwriting environments.
///
/// ### Usage Patterns
///
/// **Defaults** (sequential scoring, importance by rule id):
/// {@snippet :
/// var env = CreditxFactory.createEnvironment();
/// env.getConfigStore().reload(source);
/// }
///
/// **Configured and loaded in one step**:
/// {@snippet :
/// var env = CreditxFactory.createEnvironment(
///     CreditxConfig.fromProperties(properties), JacksonWeightsConfigSource.defaults());
/// }
///
/// @implNote Utility class with only static methods.
///
/// @see CreditxEnvironment
/// @see CreditxConfig
public final class CreditxFactory {

    private static final Logger logger = Logger.getLogger(CreditxFactory.class.getName());

    private CreditxFactory() {}

    /// Creates an environment with default configuration and no weights loaded.
    ///
    /// @return environment, never null
    public static CreditxEnvironment createEnvironment() {
        return createEnvironment(new CreditxConfig());
    }

    /// Creates an environment with no weights loaded.
    ///
    /// @apiNote **Side effects**: creates a fixed worker pool when `parallelism > 1`
    ///
    /// @param config configuration options, not null
    /// @return environment, never null
    public static CreditxEnvironment createEnvironment(CreditxConfig config) {
        return createEnvironment(config, new WeightsConfigStore(Clock.systemUTC()));
    }

    /// Creates an environment around an existing store.
    ///
    /// Useful when several environments share one set of weights, or in tests that need a
    /// fixed clock.
    ///
    /// @param config configuration options, not null
    /// @param store weights store, not null
    /// @return environment, never null
    public static CreditxEnvironment createEnvironment(
            CreditxConfig config, WeightsConfigStore store) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(store, "store must not be null");

        ExecutorService executorService =
                config.getParallelism() > 1
                        ? Executors.newFixedThreadPool(
                                config.getParallelism(), new WorkerThreadFactory())
                        : null;

        BatchAggregator aggregator =
                new BatchAggregator(
                        executorService, config.getParallelThreshold(), config.getImportanceKey());
        UnderwritingEngine engine = new UnderwritingEngine(store, aggregator);

        logger.info(
                "Created underwriting environment (parallelism="
                        + config.getParallelism()
                        + ", parallelThreshold="
                        + config.getParallelThreshold()
                        + ", importanceKey="
                        + config.getImportanceKey()
                        + ")");

        return new CreditxEnvironment(config, store, aggregator, engine, executorService);
    }

    /// Creates an environment and loads its initial weights.
    ///
    /// @param config configuration options, not null
    /// @param source initial weights, not null
    /// @return environment with an active snapshot, never null
    /// @throws ConfigException if the initial weights are rejected; no pool is left running
    public static CreditxEnvironment createEnvironment(
            CreditxConfig config, WeightsConfigSource source) throws ConfigException {
        CreditxEnvironment environment = createEnvironment(config);
        try {
            environment.getConfigStore().reload(source);
        } catch (ConfigException e) {
            environment.close();
            throw e;
        }
        return environment;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "creditx-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
