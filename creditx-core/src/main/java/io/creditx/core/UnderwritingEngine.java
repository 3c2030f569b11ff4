package io.creditx.core;

import io.creditx.core.batch.BatchAggregator;
import io.creditx.core.batch.BatchResult;
import io.creditx.core.config.ConfigSnapshot;
import io.creditx.core.config.NoActiveConfigException;
import io.creditx.core.config.WeightsConfigStore;
import io.creditx.core.engine.Operation;
import io.creditx.core.engine.PriceSuggestion;
import io.creditx.core.engine.RecordResult;
import io.creditx.core.engine.ScoreResult;
import io.creditx.core.record.PolicyRecord;
import io.creditx.core.record.SubmissionRecord;
import io.creditx.core.record.UnderwritingRecord;
import java.util.List;
import java.util.Objects;

/// Entry point for scoring batches against the active weights.
///
/// Every call reads the active snapshot from the store exactly once and scores the whole
/// batch against it, so a reload that lands mid-batch affects only later calls.
///
/// ### Usage
/// {@snippet :
/// try (CreditxEnvironment env = CreditxFactory.createEnvironment()) {
///     env.getConfigStore().reload(source);
///     BatchResult<ScoreResult> triage = env.getEngine().triage(submissions);
/// }
/// }
///
/// Scores and price suggestions are advisory. Nothing returned here approves or declines a
/// record.
///
/// @implNote Thread-safe; concurrent calls may observe different snapshots.
public final class UnderwritingEngine {

    private final WeightsConfigStore store;
    private final BatchAggregator aggregator;

    /// Creates an engine.
    ///
    /// @param store source of the active snapshot, not null
    /// @param aggregator batch evaluator, not null
    public UnderwritingEngine(WeightsConfigStore store, BatchAggregator aggregator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    /// Scores submissions for triage.
    ///
    /// @param submissions validated submissions, not null
    /// @return scores in input order with failures and importance, never null
    /// @throws NoActiveConfigException if no weights have been loaded
    public BatchResult<ScoreResult> triage(List<SubmissionRecord> submissions)
            throws NoActiveConfigException {
        return aggregator.triage(submissions, store.getActive());
    }

    /// Scores policies for renewal priority.
    ///
    /// @param policies validated policies, not null
    /// @return scores in input order with failures and importance, never null
    /// @throws NoActiveConfigException if no weights have been loaded
    public BatchResult<ScoreResult> renewalPriority(List<PolicyRecord> policies)
            throws NoActiveConfigException {
        return aggregator.renewalPriority(policies, store.getActive());
    }

    /// Suggests a rate and band for each submission.
    ///
    /// @param submissions validated submissions, not null
    /// @return price suggestions in input order with failures and importance, never null
    /// @throws NoActiveConfigException if no weights have been loaded
    public BatchResult<PriceSuggestion> price(List<SubmissionRecord> submissions)
            throws NoActiveConfigException {
        return aggregator.price(submissions, store.getActive());
    }

    /// Runs any operation.
    ///
    /// @param records validated records, not null
    /// @param operation operation to perform, not null
    /// @return batch result, never null
    /// @throws NoActiveConfigException if no weights have been loaded
    public BatchResult<? extends RecordResult> run(
            List<? extends UnderwritingRecord> records, Operation operation)
            throws NoActiveConfigException {
        ConfigSnapshot snapshot = store.getActive();
        return aggregator.runBatch(records, operation, snapshot);
    }

    /// Returns the version of the active weights.
    ///
    /// @return active version
    /// @throws NoActiveConfigException if no weights have been loaded
    public String activeVersion() throws NoActiveConfigException {
        return store.getActive().version();
    }
}
