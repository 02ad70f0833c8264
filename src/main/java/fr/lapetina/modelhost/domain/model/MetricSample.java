package fr.lapetina.modelhost.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One timestamped snapshot of system resource metrics.
 * Immutable once recorded. Network counters are cumulative since boot.
 */
public record MetricSample(
        Instant timestamp,
        double cpuPercent,
        int cpuCount,
        double cpuFrequencyMhz,
        Double cpuTemperatureCelsius,
        long memoryTotalBytes,
        long memoryUsedBytes,
        long memoryAvailableBytes,
        double memoryPercent,
        long diskTotalBytes,
        long diskUsedBytes,
        long diskFreeBytes,
        double diskPercent,
        long networkBytesSent,
        long networkBytesReceived,
        long networkPacketsSent,
        long networkPacketsReceived,
        List<AcceleratorMetrics> accelerators,
        int processCount,
        Instant bootTime
) {
    public MetricSample {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        accelerators = accelerators != null ? List.copyOf(accelerators) : List.of();
        if (bootTime == null) {
            bootTime = timestamp;
        }
    }

    /**
     * All-zero sample used when collection fails, so one bad reading does not
     * halt monitoring.
     */
    public static MetricSample empty(Instant timestamp) {
        return new MetricSample(timestamp, 0.0, 0, 0.0, null,
                0, 0, 0, 0.0,
                0, 0, 0, 0.0,
                0, 0, 0, 0,
                List.of(), 0, timestamp);
    }

    public OptionalDouble cpuTemperature() {
        return cpuTemperatureCelsius != null
                ? OptionalDouble.of(cpuTemperatureCelsius)
                : OptionalDouble.empty();
    }

    public boolean hasAccelerators() {
        return !accelerators.isEmpty();
    }

    public Duration uptime() {
        Duration uptime = Duration.between(bootTime, timestamp);
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Instant timestamp = Instant.now();
        private double cpuPercent;
        private int cpuCount;
        private double cpuFrequencyMhz;
        private Double cpuTemperatureCelsius;
        private long memoryTotalBytes;
        private long memoryUsedBytes;
        private long memoryAvailableBytes;
        private double memoryPercent;
        private long diskTotalBytes;
        private long diskUsedBytes;
        private long diskFreeBytes;
        private double diskPercent;
        private long networkBytesSent;
        private long networkBytesReceived;
        private long networkPacketsSent;
        private long networkPacketsReceived;
        private List<AcceleratorMetrics> accelerators = List.of();
        private int processCount;
        private Instant bootTime;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder cpu(double percent, int count, double frequencyMhz) {
            this.cpuPercent = percent;
            this.cpuCount = count;
            this.cpuFrequencyMhz = frequencyMhz;
            return this;
        }

        public Builder cpuPercent(double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        public Builder cpuTemperature(Double celsius) {
            this.cpuTemperatureCelsius = celsius;
            return this;
        }

        public Builder memory(long totalBytes, long usedBytes, long availableBytes) {
            this.memoryTotalBytes = totalBytes;
            this.memoryUsedBytes = usedBytes;
            this.memoryAvailableBytes = availableBytes;
            this.memoryPercent = totalBytes > 0 ? (usedBytes * 100.0) / totalBytes : 0.0;
            return this;
        }

        public Builder memoryPercent(double memoryPercent) {
            this.memoryPercent = memoryPercent;
            return this;
        }

        public Builder disk(long totalBytes, long usedBytes, long freeBytes) {
            this.diskTotalBytes = totalBytes;
            this.diskUsedBytes = usedBytes;
            this.diskFreeBytes = freeBytes;
            this.diskPercent = totalBytes > 0 ? (usedBytes * 100.0) / totalBytes : 0.0;
            return this;
        }

        public Builder diskPercent(double diskPercent) {
            this.diskPercent = diskPercent;
            return this;
        }

        public Builder network(long bytesSent, long bytesReceived, long packetsSent, long packetsReceived) {
            this.networkBytesSent = bytesSent;
            this.networkBytesReceived = bytesReceived;
            this.networkPacketsSent = packetsSent;
            this.networkPacketsReceived = packetsReceived;
            return this;
        }

        public Builder accelerators(List<AcceleratorMetrics> accelerators) {
            this.accelerators = accelerators;
            return this;
        }

        public Builder processCount(int processCount) {
            this.processCount = processCount;
            return this;
        }

        public Builder bootTime(Instant bootTime) {
            this.bootTime = bootTime;
            return this;
        }

        public MetricSample build() {
            return new MetricSample(timestamp, cpuPercent, cpuCount, cpuFrequencyMhz, cpuTemperatureCelsius,
                    memoryTotalBytes, memoryUsedBytes, memoryAvailableBytes, memoryPercent,
                    diskTotalBytes, diskUsedBytes, diskFreeBytes, diskPercent,
                    networkBytesSent, networkBytesReceived, networkPacketsSent, networkPacketsReceived,
                    accelerators, processCount, bootTime);
        }
    }
}
