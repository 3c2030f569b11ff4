package io.creditx.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.creditx.core.batch.BatchAggregator;
import io.creditx.core.batch.BatchResult;
import io.creditx.core.config.NoActiveConfigException;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.config.WeightsConfigStore;
import io.creditx.core.engine.Operation;
import io.creditx.core.engine.PriceSuggestion;
import io.creditx.core.engine.RecordResult;
import io.creditx.core.engine.ScoreResult;
import io.creditx.core.feature.Feature;
import io.creditx.core.record.Sector;
import io.creditx.core.record.SubmissionRecord;
import io.creditx.core.rule.FlagRule;
import io.creditx.core.rule.ReasonTemplate;
import io.creditx.core.rule.RuleSet;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UnderwritingEngine")
class UnderwritingEngineTest {

    private WeightsConfigStore store;
    private UnderwritingEngine engine;

    @BeforeEach
    void setUp() {
        store = new WeightsConfigStore();
        engine = new UnderwritingEngine(store, new BatchAggregator());
    }

    @Nested
    @DisplayName("before the first load")
    class Unloaded {

        @Test
        void shouldRejectTriage() {
            assertThatThrownBy(() -> engine.triage(List.of(TestWeights.strongRetail("S-1"))))
                    .isInstanceOf(NoActiveConfigException.class);
        }

        @Test
        void shouldRejectActiveVersion() {
            assertThatThrownBy(() -> engine.activeVersion())
                    .isInstanceOf(NoActiveConfigException.class);
        }
    }

    @Nested
    @DisplayName("with weights loaded")
    class Loaded {

        @BeforeEach
        void load() throws Exception {
            store.reload(TestWeights.config());
        }

        @Test
        void shouldReportActiveVersion() throws Exception {
            assertThat(engine.activeVersion()).isEqualTo("test-1");
        }

        @Test
        void shouldTriageWithActiveVersion() throws Exception {
            BatchResult<ScoreResult> result =
                    engine.triage(List.of(TestWeights.strongRetail("S-1")));

            assertThat(result.weightsVersion()).isEqualTo("test-1");
            assertThat(result.results().get(0).score()).isCloseTo(0.7, within(1e-9));
        }

        @Test
        void shouldPrice() throws Exception {
            BatchResult<PriceSuggestion> result =
                    engine.price(List.of(TestWeights.strongRetail("S-1")));

            assertThat(result.results().get(0).suggestedRateBps()).isEqualTo(195);
        }

        @Test
        void shouldRunOperationByName() throws Exception {
            BatchResult<? extends RecordResult> result =
                    engine.run(
                            List.of(TestWeights.policy("P-1", 0.85, 2, 1.8, 25, -0.2)),
                            Operation.RENEWAL_PRIORITY);

            assertThat(result.operation()).isEqualTo(Operation.RENEWAL_PRIORITY);
            assertThat(result.results()).singleElement().isInstanceOf(ScoreResult.class);
        }
    }

    @Test
    @DisplayName("every record in a batch is scored with the version the batch reports")
    void shouldScoreWholeBatchWithOneVersionDuringReloads() throws Exception {
        // Given: v1 weighs financials at 0.2, v2 at 0.4
        WeightsConfig v1 = TestWeights.builder().version("v1").build();
        WeightsConfig v2 =
                TestWeights.builder()
                        .version("v2")
                        .triageRules(
                                RuleSet.of(
                                        new FlagRule(
                                                "financials_attached",
                                                Feature.FINANCIALS_ATTACHED,
                                                true,
                                                0.4,
                                                ReasonTemplate.of("Financial statements provided")),
                                        new FlagRule(
                                                "no_judgements",
                                                Feature.HAS_JUDGEMENTS,
                                                false,
                                                0.1,
                                                ReasonTemplate.of("No outstanding judgements"))))
                        .build();
        store.reload(v1);

        List<SubmissionRecord> batch = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            batch.add(
                    TestWeights.submission("S-" + i, Sector.RETAIL, 90, true, 5, 0.1, 0.5, false));
        }

        ExecutorService reloader = Executors.newSingleThreadExecutor();
        AtomicBoolean running = new AtomicBoolean(true);
        try {
            Future<?> reloads =
                    reloader.submit(
                            () -> {
                                boolean flip = false;
                                while (running.get()) {
                                    store.reload(flip ? v1 : v2);
                                    flip = !flip;
                                }
                                return null;
                            });

            // When
            List<BatchResult<ScoreResult>> results = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                results.add(engine.triage(batch));
            }
            running.set(false);
            reloads.get(5, TimeUnit.SECONDS);

            // Then
            for (BatchResult<ScoreResult> result : results) {
                double expected = "v1".equals(result.weightsVersion()) ? 0.3 : 0.5;
                assertThat(result.results())
                        .allSatisfy(r -> assertThat(r.score()).isCloseTo(expected, within(1e-9)));
            }
        } finally {
            running.set(false);
            reloader.shutdownNow();
        }
    }
}
