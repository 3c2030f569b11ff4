package io.creditx.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.creditx.core.TestWeights;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WeightsConfigStoreTest {

    private static final Instant FIRST = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant SECOND = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private WeightsConfigSource source;

    private WeightsConfigStore store;

    @BeforeEach
    void setUp() {
        store = new WeightsConfigStore(Clock.fixed(FIRST, java.time.ZoneOffset.UTC));
    }

    @Test
    void shouldFailBeforeFirstLoad() {
        assertThat(store.describe()).isEmpty();
        assertThatThrownBy(() -> store.getActive()).isInstanceOf(NoActiveConfigException.class);
    }

    @Test
    void shouldActivateValidConfiguration() throws Exception {
        // Given
        when(source.load()).thenReturn(TestWeights.config());

        // When
        WeightsConfig loaded = store.reload(source);

        // Then
        assertThat(loaded.getVersion()).isEqualTo("test-1");
        assertThat(store.getActive().config()).isSameAs(loaded);
        assertThat(store.describe()).contains(new SnapshotDescriptor("test-1", FIRST));
    }

    @Test
    void shouldReplaceActiveSnapshotOnReload() throws Exception {
        Clock clock = org.mockito.Mockito.mock(Clock.class);
        when(clock.instant()).thenReturn(FIRST, SECOND);
        store = new WeightsConfigStore(clock);

        store.reload(TestWeights.config());
        store.reload(TestWeights.builder().version("test-2").build());

        assertThat(store.describe()).contains(new SnapshotDescriptor("test-2", SECOND));
    }

    @Test
    void shouldKeepPreviousSnapshotWhenValidationFails() throws Exception {
        // Given
        store.reload(TestWeights.config());
        SnapshotDescriptor before = store.describe().orElseThrow();
        WeightsConfig invalid =
                TestWeights.builder()
                        .version("broken")
                        .sectorBaseRates(Map.of())
                        .build();

        // When / Then
        assertThatThrownBy(() -> store.reload(invalid))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("sector_base_rates is missing sector Retail");
        assertThat(store.describe()).contains(before);
        assertThat(store.getActive().version()).isEqualTo("test-1");
    }

    @Test
    void shouldKeepPreviousSnapshotWhenSourceFails() throws Exception {
        store.reload(TestWeights.config());
        when(source.load()).thenThrow(new ConfigException("Malformed YAML weights document"));

        assertThatThrownBy(() -> store.reload(source))
                .isInstanceOf(ConfigException.class)
                .hasMessage("Malformed YAML weights document");
        assertThat(store.getActive().version()).isEqualTo("test-1");
    }

    @Test
    void shouldRejectSourceProducingNothing() throws Exception {
        when(source.load()).thenReturn(null);

        assertThatThrownBy(() -> store.reload(source))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("produced no configuration");
        assertThat(store.describe()).isEmpty();
    }

    @Test
    void shouldServeConsistentSnapshotsDuringConcurrentReloads() throws Exception {
        WeightsConfig v1 = TestWeights.builder().version("v1").build();
        WeightsConfig v2 = TestWeights.builder().version("v2").build();
        store.reload(v1);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(
                        pool.submit(
                                () -> {
                                    start.await();
                                    for (int n = 0; n < 2_000; n++) {
                                        ConfigSnapshot snapshot = store.getActive();
                                        if (!snapshot.version()
                                                .equals(snapshot.config().getVersion())) {
                                            return false;
                                        }
                                    }
                                    return true;
                                }));
            }
            Future<?> writer =
                    pool.submit(
                            () -> {
                                start.await();
                                for (int n = 0; n < 200; n++) {
                                    store.reload(n % 2 == 0 ? v2 : v1);
                                }
                                return null;
                            });

            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            for (Future<Boolean> reader : readers) {
                assertThat(reader.get(10, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.getActive().version()).isEqualTo("v1");
    }
}
