package io.creditx.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.creditx.core.config.ConfigException;
import io.creditx.core.config.WeightsConfigSource;
import io.creditx.core.config.WeightsConfigStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("CreditxFactory")
@ExtendWith(MockitoExtension.class)
class CreditxFactoryTest {

    private CreditxEnvironment environment;

    @Mock private WeightsConfigSource source;

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
    }

    @Test
    @DisplayName("runs batches on the calling thread by default")
    void shouldNotCreatePoolForDefaultParallelism() {
        environment = CreditxFactory.createEnvironment();

        assertThat(environment.getExecutorService()).isNull();
        assertThat(environment.getConfigStore().describe()).isEmpty();
    }

    @Test
    void shouldCreatePoolWhenParallel() {
        environment =
                CreditxFactory.createEnvironment(CreditxConfig.builder().parallelism(3).build());

        assertThat(environment.getExecutorService()).isNotNull();
        assertThat(environment.getExecutorService().isShutdown()).isFalse();
    }

    @Test
    void shouldWireProvidedStore() {
        WeightsConfigStore store =
                new WeightsConfigStore(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));

        environment = CreditxFactory.createEnvironment(new CreditxConfig(), store);

        assertThat(environment.getConfigStore()).isSameAs(store);
    }

    @Test
    void shouldLoadInitialWeights() throws Exception {
        when(source.load()).thenReturn(TestWeights.config());

        environment = CreditxFactory.createEnvironment(new CreditxConfig(), source);

        assertThat(environment.getEngine().activeVersion()).isEqualTo("test-1");
    }

    @Test
    void shouldPropagateRejectedInitialWeights() throws Exception {
        when(source.load()).thenThrow(new ConfigException("broken weights"));
        when(source.describe()).thenReturn("test source");

        assertThatThrownBy(
                        () ->
                                CreditxFactory.createEnvironment(
                                        CreditxConfig.builder().parallelism(2).build(), source))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("broken weights");
    }
}
