package fr.lapetina.modelhost.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Means over the samples of a time window.
 *
 * Network throughput is the counter delta between the oldest and newest
 * sample of the window divided by the seconds between them; zero with a
 * single sample or when a counter went backwards.
 */
public record MetricAverage(
        @JsonProperty("window_seconds") long windowSeconds,
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("avg_cpu_percent") double cpuPercent,
        @JsonProperty("avg_memory_percent") double memoryPercent,
        @JsonProperty("avg_disk_percent") double diskPercent,
        @JsonProperty("avg_network_bytes_sent_per_sec") double networkBytesSentPerSecond,
        @JsonProperty("avg_network_bytes_recv_per_sec") double networkBytesReceivedPerSecond
) {

    public static MetricAverage of(Duration window, int sampleCount, double cpu, double memory, double disk,
                                   double sentPerSecond, double receivedPerSecond) {
        return new MetricAverage(window.toSeconds(), sampleCount, cpu, memory, disk, sentPerSecond, receivedPerSecond);
    }
}
