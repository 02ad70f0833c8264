package fr.lapetina.modelhost.integration;

import fr.lapetina.modelhost.disruptor.TelemetryPipeline;
import fr.lapetina.modelhost.domain.model.MetricSample;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the telemetry Disruptor pipeline.
 */
class TelemetryPipelineIntegrationTest {

    private MetricsRegistry metricsRegistry;
    private TelemetryStore store;
    private TelemetryPipeline pipeline;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test");
        store = new TelemetryStore(100);
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metricsRegistry.close();
    }

    private TelemetryPipeline pipeline(int ringSize) {
        pipeline = TelemetryPipeline.builder()
                .ringBufferSize(ringSize)
                .waitStrategy("blocking")
                .store(store)
                .metricsRegistry(metricsRegistry)
                .build();
        pipeline.start();
        return pipeline;
    }

    private static MetricSample sample(double cpu) {
        return MetricSample.builder().timestamp(Instant.now()).cpuPercent(cpu).build();
    }

    private void awaitStoreSize(int size) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.size() < size && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("should record published samples in order and update gauges")
    void shouldRecordSamples() throws InterruptedException {
        pipeline(16);

        for (int i = 1; i <= 10; i++) {
            assertThat(pipeline.publish(sample(i))).isTrue();
        }
        awaitStoreSize(10);

        assertThat(store.history()).extracting(MetricSample::cpuPercent)
                .containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0);
        long deadline = System.currentTimeMillis() + 5_000;
        while (samplesRecorded() < 10 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(samplesRecorded()).isEqualTo(10.0);
        assertThat(metricsRegistry.getRegistry().get("test_host_cpu_percent").gauge().value()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("should drop samples instead of blocking when the ring is full")
    void shouldDropWhenFull() throws InterruptedException {
        pipeline(4);
        int accepted = 0;
        int dropped = 0;

        // Holding the store monitor stalls the recording stage
        synchronized (store) {
            for (int i = 0; i < 10; i++) {
                if (pipeline.publish(sample(i))) {
                    accepted++;
                } else {
                    dropped++;
                }
            }
        }
        awaitStoreSize(accepted);

        assertThat(accepted).isEqualTo(4);
        assertThat(dropped).isEqualTo(6);
        assertThat(store.size()).isEqualTo(accepted);
        assertThat(metricsRegistry.getRegistry().get("test_telemetry_samples_dropped_total").counter().count())
                .isEqualTo(6.0);
    }

    @Test
    @DisplayName("should refuse samples before start and after close")
    void shouldRefuseWhenNotRunning() {
        pipeline = TelemetryPipeline.builder().store(store).metricsRegistry(metricsRegistry).build();
        assertThat(pipeline.publish(sample(1))).isFalse();

        pipeline.start();
        pipeline.close();

        assertThat(pipeline.publish(sample(1))).isFalse();
        assertThat(pipeline.isRunning()).isFalse();
    }

    private double samplesRecorded() {
        return metricsRegistry.getRegistry().get("test_telemetry_samples_total").counter().count();
    }
}
