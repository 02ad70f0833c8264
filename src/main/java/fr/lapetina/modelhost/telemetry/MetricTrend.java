package fr.lapetina.modelhost.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Newest minus oldest value over the last {@code sampleCount} samples,
 * in percentage points. Positive means rising.
 */
public record MetricTrend(
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("cpu_trend_percent") double cpuDelta,
        @JsonProperty("memory_trend_percent") double memoryDelta
) {

    public boolean isCpuRisingBy(double points) {
        return cpuDelta > points;
    }
}
