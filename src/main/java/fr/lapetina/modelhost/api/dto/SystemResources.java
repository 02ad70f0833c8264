package fr.lapetina.modelhost.api.dto;

import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import fr.lapetina.modelhost.domain.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Grouped view of one fresh sample, served by {@code GET /system/resources}.
 */
public record SystemResources(
        Instant timestamp,
        Cpu cpu,
        Memory memory,
        Disk disk,
        List<Gpu> gpu,
        Network network,
        SystemInfo system
) {

    public record Cpu(double percent, int count, double frequencyMhz, Double temperatureCelsius) {
    }

    public record Memory(long total, long available, long used, double percent) {
    }

    public record Disk(long total, long used, long free, double percent) {
    }

    public record Gpu(int id, String name, long memoryTotal, long memoryUsed, long memoryFree,
                      double memoryPercent, double utilizationPercent) {

        static Gpu from(AcceleratorMetrics accelerator) {
            return new Gpu(
                    accelerator.id(),
                    accelerator.name(),
                    accelerator.memoryTotalBytes(),
                    accelerator.memoryUsedBytes(),
                    accelerator.memoryFreeBytes(),
                    accelerator.memoryPercent(),
                    accelerator.utilizationPercent()
            );
        }
    }

    public record Network(long bytesSent, long bytesRecv, long packetsSent, long packetsRecv) {
    }

    public record SystemInfo(Instant bootTime, double uptimeSeconds, int processCount) {
    }

    public static SystemResources from(MetricSample sample) {
        return new SystemResources(
                sample.timestamp(),
                new Cpu(sample.cpuPercent(), sample.cpuCount(), sample.cpuFrequencyMhz(),
                        sample.cpuTemperatureCelsius()),
                new Memory(sample.memoryTotalBytes(), sample.memoryAvailableBytes(),
                        sample.memoryUsedBytes(), sample.memoryPercent()),
                new Disk(sample.diskTotalBytes(), sample.diskUsedBytes(), sample.diskFreeBytes(),
                        sample.diskPercent()),
                sample.accelerators().stream().map(Gpu::from).toList(),
                new Network(sample.networkBytesSent(), sample.networkBytesReceived(),
                        sample.networkPacketsSent(), sample.networkPacketsReceived()),
                new SystemInfo(sample.bootTime(), sample.uptime().toMillis() / 1000.0, sample.processCount())
        );
    }
}
