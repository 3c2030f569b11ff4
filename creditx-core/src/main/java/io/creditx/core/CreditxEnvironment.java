package io.creditx.core;

import io.creditx.core.batch.BatchAggregator;
import io.creditx.core.config.WeightsConfigStore;
import java.util.concurrent.ExecutorService;

/// Container holding the wired underwriting components.
///
/// Implements {@link AutoCloseable} to release the worker pool when one was created.
///
/// ### Contracts
/// - **Postcondition**: all getters return the same instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link CreditxFactory} rather than direct construction.
///
/// @see CreditxFactory#createEnvironment(CreditxConfig)
public final class CreditxEnvironment implements AutoCloseable {

    private final CreditxConfig config;
    private final WeightsConfigStore configStore;
    private final BatchAggregator aggregator;
    private final UnderwritingEngine engine;
    private final ExecutorService executorService;

    /// Creates an environment.
    ///
    /// @param config configuration used for wiring, not null
    /// @param configStore weights store, not null
    /// @param aggregator batch evaluator, not null
    /// @param engine engine facade, not null
    /// @param executorService worker pool, may be null when batches run sequentially
    public CreditxEnvironment(
            CreditxConfig config,
            WeightsConfigStore configStore,
            BatchAggregator aggregator,
            UnderwritingEngine engine,
            ExecutorService executorService) {
        this.config = config;
        this.configStore = configStore;
        this.aggregator = aggregator;
        this.engine = engine;
        this.executorService = executorService;
    }

    public CreditxConfig getConfig() {
        return config;
    }

    /// Returns the store used to reload and inspect weights.
    ///
    /// @return config store, never null
    public WeightsConfigStore getConfigStore() {
        return configStore;
    }

    public BatchAggregator getAggregator() {
        return aggregator;
    }

    /// Returns the engine facade.
    ///
    /// @return engine, never null
    public UnderwritingEngine getEngine() {
        return engine;
    }

    /// Returns the worker pool.
    ///
    /// @return worker pool, or null when parallelism is 1
    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts down the worker pool, if any.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block; batches already
    /// submitted finish normally.
    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdown();
        }
    }
}
