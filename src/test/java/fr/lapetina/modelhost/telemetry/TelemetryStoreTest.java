package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TelemetryStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TelemetryStore store;

    @BeforeEach
    void setUp() {
        store = new TelemetryStore(3, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MetricSample sample(Instant at, double cpu, double memory) {
        return MetricSample.builder()
                .timestamp(at)
                .cpuPercent(cpu)
                .memoryPercent(memory)
                .diskPercent(50.0)
                .build();
    }

    @Test
    @DisplayName("should reject a non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new TelemetryStore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should evict the oldest sample when full")
    void shouldEvictOldestWhenFull() {
        for (int i = 1; i <= 4; i++) {
            store.append(sample(NOW.minusSeconds(10 - i), i, 0));
        }

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.history()).extracting(MetricSample::cpuPercent).containsExactly(2.0, 3.0, 4.0);
        assertThat(store.latest()).map(MetricSample::cpuPercent).contains(4.0);
    }

    @Test
    @DisplayName("should return the newest samples oldest first when limited")
    void shouldReturnLimitedTail() {
        store.append(sample(NOW.minusSeconds(3), 1, 0));
        store.append(sample(NOW.minusSeconds(2), 2, 0));
        store.append(sample(NOW.minusSeconds(1), 3, 0));

        assertThat(store.history(2)).extracting(MetricSample::cpuPercent).containsExactly(2.0, 3.0);
        assertThat(store.history(0)).hasSize(3);
        assertThat(store.history(10)).hasSize(3);
    }

    @Test
    @DisplayName("should return copies that are unaffected by later appends")
    void shouldReturnCopies() {
        store.append(sample(NOW, 1, 0));
        List<MetricSample> before = store.history();

        store.append(sample(NOW, 2, 0));

        assertThat(before).hasSize(1);
    }

    @Test
    @DisplayName("should be empty before the first sample")
    void shouldBeEmptyInitially() {
        assertThat(store.latest()).isEmpty();
        assertThat(store.averageOver(Duration.ofMinutes(5))).isEmpty();
        assertThat(store.trend(10)).isEmpty();
    }

    @Nested
    @DisplayName("averageOver")
    class AverageOver {

        @Test
        @DisplayName("should average only samples inside the window")
        void shouldAverageInsideWindow() {
            store.append(sample(NOW.minus(Duration.ofMinutes(10)), 90, 90));
            store.append(sample(NOW.minus(Duration.ofMinutes(2)), 20, 40));
            store.append(sample(NOW.minus(Duration.ofMinutes(1)), 40, 60));

            MetricAverage average = store.averageOver(Duration.ofMinutes(5)).orElseThrow();

            assertThat(average.sampleCount()).isEqualTo(2);
            assertThat(average.cpuPercent()).isCloseTo(30.0, within(1e-9));
            assertThat(average.memoryPercent()).isCloseTo(50.0, within(1e-9));
            assertThat(average.windowSeconds()).isEqualTo(300);
        }

        @Test
        @DisplayName("should be empty when no sample falls in the window")
        void shouldBeEmptyOutsideWindow() {
            store.append(sample(NOW.minus(Duration.ofHours(1)), 10, 10));

            assertThat(store.averageOver(Duration.ofMinutes(5))).isEmpty();
        }

        @Test
        @DisplayName("should report network throughput as a rate between first and last sample")
        void shouldReportNetworkRate() {
            store.append(MetricSample.builder().timestamp(NOW.minusSeconds(10)).network(1_000, 5_000, 1, 1).build());
            store.append(MetricSample.builder().timestamp(NOW).network(3_000, 10_000, 2, 2).build());

            MetricAverage average = store.averageOver(Duration.ofMinutes(1)).orElseThrow();

            assertThat(average.networkBytesSentPerSecond()).isCloseTo(200.0, within(1e-9));
            assertThat(average.networkBytesReceivedPerSecond()).isCloseTo(500.0, within(1e-9));
        }

        @Test
        @DisplayName("should report zero throughput for a single sample or a counter reset")
        void shouldReportZeroThroughputWhenUndefined() {
            store.append(MetricSample.builder().timestamp(NOW.minusSeconds(10)).network(5_000, 5_000, 1, 1).build());
            assertThat(store.averageOver(Duration.ofMinutes(1)).orElseThrow().networkBytesSentPerSecond()).isZero();

            store.append(MetricSample.builder().timestamp(NOW).network(100, 100, 1, 1).build());
            assertThat(store.averageOver(Duration.ofMinutes(1)).orElseThrow().networkBytesSentPerSecond()).isZero();
        }

        @Test
        @DisplayName("should add nothing for the interval where a counter resets")
        void shouldSumIncreasesAcrossReset() {
            store.append(MetricSample.builder().timestamp(NOW.minusSeconds(10)).network(1_000, 1_000, 1, 1).build());
            store.append(MetricSample.builder().timestamp(NOW.minusSeconds(5)).network(2_000, 3_000, 1, 1).build());
            store.append(MetricSample.builder().timestamp(NOW).network(500, 400, 1, 1).build());

            MetricAverage average = store.averageOver(Duration.ofMinutes(1)).orElseThrow();

            // Only the first interval counts: 1000 and 2000 bytes over 10 seconds
            assertThat(average.networkBytesSentPerSecond()).isCloseTo(100.0, within(1e-9));
            assertThat(average.networkBytesReceivedPerSecond()).isCloseTo(200.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("trend")
    class Trend {

        @Test
        @DisplayName("should compute newest minus oldest over the window")
        void shouldComputeDelta() {
            store.append(sample(NOW.minusSeconds(3), 10, 50));
            store.append(sample(NOW.minusSeconds(2), 20, 45));
            store.append(sample(NOW.minusSeconds(1), 35, 40));

            MetricTrend trend = store.trend(3).orElseThrow();

            assertThat(trend.sampleCount()).isEqualTo(3);
            assertThat(trend.cpuDelta()).isCloseTo(25.0, within(1e-9));
            assertThat(trend.memoryDelta()).isCloseTo(-10.0, within(1e-9));
            assertThat(trend.isCpuRisingBy(20.0)).isTrue();
            assertThat(trend.isCpuRisingBy(25.0)).isFalse();
        }

        @Test
        @DisplayName("should need at least two samples")
        void shouldNeedTwoSamples() {
            store.append(sample(NOW, 10, 10));

            assertThat(store.trend(10)).isEmpty();
        }

        @Test
        @DisplayName("should reject a window smaller than two samples")
        void shouldRejectSingleSampleWindow() {
            store.append(sample(NOW.minusSeconds(2), 10, 10));
            store.append(sample(NOW.minusSeconds(1), 30, 10));

            assertThatThrownBy(() -> store.trend(1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at least 2");
            assertThat(store.trend(2).orElseThrow().cpuDelta()).isCloseTo(20.0, within(1e-9));
        }
    }
}
