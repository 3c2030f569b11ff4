package io.creditx.core.batch;

import io.creditx.core.config.ConfigSnapshot;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.engine.Operation;
import io.creditx.core.engine.PriceSuggestion;
import io.creditx.core.engine.PricingClassifier;
import io.creditx.core.engine.RecordResult;
import io.creditx.core.engine.RuleEngine;
import io.creditx.core.engine.ScoreResult;
import io.creditx.core.feature.FeatureSet;
import io.creditx.core.feature.PolicyFeatureExtractor;
import io.creditx.core.feature.SubmissionFeatureExtractor;
import io.creditx.core.record.PolicyRecord;
import io.creditx.core.record.SubmissionRecord;
import io.creditx.core.record.UnderwritingRecord;
import io.creditx.core.rule.RuleFiring;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs an operation over a batch of records against one captured weights snapshot.
///
/// Each record is scored independently: features are extracted, then the rule engine
/// (triage, renewal priority) or the pricing classifier (pricing) is applied. Records that
/// cannot be scored are reported as {@link RecordFailure}s and the rest of the batch
/// continues. Feature importance counts, over all successful results, how many records each
/// rule fired for.
///
/// ### Parallelism
/// When an executor is configured and the batch reaches the parallel threshold, records fan
/// out to the executor. Results are always returned in input order; only the order of
/// reasons within a record is significant and that is fixed by rule order.
///
/// @implNote Thread-safe. Holds no per-batch state; the executor is owned by the caller.
///
/// @see io.creditx.core.UnderwritingEngine for the snapshot-capturing facade
public final class BatchAggregator {

    private static final Logger logger = Logger.getLogger(BatchAggregator.class.getName());

    private final SubmissionFeatureExtractor submissionExtractor = new SubmissionFeatureExtractor();
    private final PolicyFeatureExtractor policyExtractor = new PolicyFeatureExtractor();
    private final RuleEngine ruleEngine;
    private final PricingClassifier pricingClassifier;
    private final ExecutorService executor;
    private final int parallelThreshold;
    private final ImportanceKey importanceKey;

    /// Creates a sequential aggregator keying importance by rule id.
    public BatchAggregator() {
        this(null, Integer.MAX_VALUE, ImportanceKey.RULE_ID);
    }

    /// Creates an aggregator.
    ///
    /// @param executor pool for parallel fan-out, may be null for sequential evaluation
    /// @param parallelThreshold minimum batch size that fans out to the executor
    /// @param importanceKey how feature-importance counts are keyed, not null
    public BatchAggregator(
            ExecutorService executor, int parallelThreshold, ImportanceKey importanceKey) {
        this.ruleEngine = new RuleEngine();
        this.pricingClassifier = new PricingClassifier(ruleEngine);
        this.executor = executor;
        this.parallelThreshold = Math.max(1, parallelThreshold);
        this.importanceKey = Objects.requireNonNull(importanceKey, "importanceKey");
    }

    /// Scores submissions for triage.
    ///
    /// @param records validated submissions, not null
    /// @param snapshot captured weights snapshot, not null
    /// @return batch of score results, never null
    public BatchResult<ScoreResult> triage(
            List<SubmissionRecord> records, ConfigSnapshot snapshot) {
        return run(records, Operation.TRIAGE, snapshot, ScoreResult.class);
    }

    /// Scores policies for renewal priority.
    ///
    /// @param records validated policies, not null
    /// @param snapshot captured weights snapshot, not null
    /// @return batch of score results, never null
    public BatchResult<ScoreResult> renewalPriority(
            List<PolicyRecord> records, ConfigSnapshot snapshot) {
        return run(records, Operation.RENEWAL_PRIORITY, snapshot, ScoreResult.class);
    }

    /// Prices submissions.
    ///
    /// @param records validated submissions, not null
    /// @param snapshot captured weights snapshot, not null
    /// @return batch of price suggestions, never null
    public BatchResult<PriceSuggestion> price(
            List<SubmissionRecord> records, ConfigSnapshot snapshot) {
        return run(records, Operation.PRICING, snapshot, PriceSuggestion.class);
    }

    /// Runs any operation over a batch of records.
    ///
    /// Records whose kind does not match the operation are reported as failures.
    ///
    /// @param records validated records, not null
    /// @param operation operation to perform, not null
    /// @param snapshot captured weights snapshot, not null
    /// @return batch result, never null
    /// @throws BatchExecutionException if parallel evaluation is interrupted
    public BatchResult<? extends RecordResult> runBatch(
            List<? extends UnderwritingRecord> records,
            Operation operation,
            ConfigSnapshot snapshot) {
        return switch (operation) {
            case TRIAGE, RENEWAL_PRIORITY -> run(records, operation, snapshot, ScoreResult.class);
            case PRICING -> run(records, operation, snapshot, PriceSuggestion.class);
        };
    }

    private <T extends RecordResult> BatchResult<T> run(
            List<? extends UnderwritingRecord> records,
            Operation operation,
            ConfigSnapshot snapshot,
            Class<T> resultType) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        WeightsConfig config = snapshot.config();
        List<Outcome> outcomes =
                executor != null && records.size() >= parallelThreshold
                        ? evaluateParallel(records, operation, config)
                        : evaluateSequential(records, operation, config);

        List<T> results = new ArrayList<>(outcomes.size());
        List<RecordFailure> failures = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                results.add(resultType.cast(outcome.result()));
            }
        }

        Map<String, Integer> importance = featureImportance(results);

        logger.info(
                operation
                        + " batch of "
                        + records.size()
                        + " records scored with weights "
                        + snapshot.version()
                        + " ("
                        + failures.size()
                        + " failed)");

        return new BatchResult<>(operation, snapshot.version(), results, failures, importance);
    }

    private List<Outcome> evaluateSequential(
            List<? extends UnderwritingRecord> records, Operation operation, WeightsConfig config) {
        List<Outcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            outcomes.add(outcome(i, records.get(i), operation, config));
        }
        return outcomes;
    }

    private List<Outcome> evaluateParallel(
            List<? extends UnderwritingRecord> records, Operation operation, WeightsConfig config) {
        List<Future<Outcome>> futures = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            int index = i;
            UnderwritingRecord record = records.get(i);
            futures.add(executor.submit(() -> outcome(index, record, operation, config)));
        }

        List<Outcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(futures);
            throw new BatchExecutionException(operation + " batch interrupted", e);
        } catch (ExecutionException e) {
            cancel(futures);
            throw new BatchExecutionException(
                    operation + " batch failed: " + e.getCause().getMessage(), e.getCause());
        }
        return outcomes;
    }

    private static void cancel(List<Future<Outcome>> futures) {
        for (Future<Outcome> future : futures) {
            future.cancel(true);
        }
    }

    private Outcome outcome(
            int index, UnderwritingRecord record, Operation operation, WeightsConfig config) {
        try {
            return new Outcome(evaluate(record, operation, config), null);
        } catch (RecordException e) {
            logger.warning(
                    "Excluding record " + index + " (" + e.getRecordId() + "): " + e.getMessage());
            return new Outcome(null, new RecordFailure(index, e.getRecordId(), e.getMessage()));
        }
    }

    /// Scores one record.
    ///
    /// @param record record to score, may be null
    /// @param operation operation to perform, not null
    /// @param config captured weights, not null
    /// @return per-record result, never null
    /// @throws RecordException if the record cannot be scored
    RecordResult evaluate(UnderwritingRecord record, Operation operation, WeightsConfig config)
            throws RecordException {
        RecordGuard.check(record, operation);

        RecordResult result =
                switch (operation) {
                    case TRIAGE -> {
                        SubmissionRecord submission = (SubmissionRecord) record;
                        FeatureSet features = submissionExtractor.extract(submission, config);
                        yield ruleEngine.score(submission.id(), features, config.getTriageRules());
                    }
                    case RENEWAL_PRIORITY -> {
                        PolicyRecord policy = (PolicyRecord) record;
                        FeatureSet features = policyExtractor.extract(policy, config);
                        yield ruleEngine.score(policy.id(), features, config.getRenewalRules());
                    }
                    case PRICING -> {
                        SubmissionRecord submission = (SubmissionRecord) record;
                        OptionalInt baseRate = config.baseRateFor(submission.sector());
                        if (baseRate.isEmpty()) {
                            throw new RecordException(
                                    submission.id(),
                                    "No base rate for sector " + submission.sector());
                        }
                        FeatureSet features = submissionExtractor.extract(submission, config);
                        yield pricingClassifier.classify(
                                submission.id(), baseRate.getAsInt(), features, config);
                    }
                };

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(operation + " " + record.id() + " -> " + result);
        }
        return result;
    }

    private Map<String, Integer> featureImportance(List<? extends RecordResult> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RecordResult result : results) {
            for (RuleFiring firing : result.firings()) {
                String key =
                        importanceKey == ImportanceKey.RULE_ID ? firing.ruleId() : firing.reason();
                counts.merge(key, 1, Integer::sum);
            }
        }
        return counts;
    }

    private record Outcome(RecordResult result, RecordFailure failure) {}
}
