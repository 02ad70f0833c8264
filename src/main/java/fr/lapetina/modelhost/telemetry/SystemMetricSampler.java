package fr.lapetina.modelhost.telemetry;

import com.sun.management.OperatingSystemMXBean;
import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import fr.lapetina.modelhost.domain.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Collects host metrics from the platform management bean, the file store
 * of a configured path and, on Linux, {@code /proc} and {@code /sys}.
 *
 * Each optional reading degrades on its own (zero, or absent for the CPU
 * temperature); an unexpected failure of the whole collection yields
 * {@link MetricSample#empty}.
 */
public final class SystemMetricSampler implements MetricSource {

    private static final Logger log = LoggerFactory.getLogger(SystemMetricSampler.class);

    private final OperatingSystemMXBean os;
    private final Path diskPath;
    private final Path procRoot;
    private final Path thermalZone;
    private final AcceleratorProbe acceleratorProbe;
    private final Clock clock;

    public SystemMetricSampler(Path diskPath, AcceleratorProbe acceleratorProbe) {
        this(diskPath, acceleratorProbe, Paths.get("/proc"),
                Paths.get("/sys/class/thermal/thermal_zone0/temp"), Clock.systemUTC());
    }

    SystemMetricSampler(Path diskPath, AcceleratorProbe acceleratorProbe, Path procRoot, Path thermalZone, Clock clock) {
        this.os = ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class);
        this.diskPath = diskPath;
        this.acceleratorProbe = acceleratorProbe;
        this.procRoot = procRoot;
        this.thermalZone = thermalZone;
        this.clock = clock;
    }

    @Override
    public MetricSample collect() {
        Instant now = clock.instant();
        try {
            MetricSample.Builder builder = MetricSample.builder()
                    .timestamp(now)
                    .cpu(cpuPercent(), Runtime.getRuntime().availableProcessors(), cpuFrequencyMhz())
                    .cpuTemperature(cpuTemperature())
                    .accelerators(accelerators())
                    .processCount(processCount())
                    .bootTime(bootTime(now));

            long memoryTotal = os.getTotalMemorySize();
            long memoryAvailable = memoryAvailable(os.getFreeMemorySize());
            builder.memory(memoryTotal, Math.max(0, memoryTotal - memoryAvailable), memoryAvailable);

            collectDisk(builder);
            collectNetwork(builder);

            return builder.build();
        } catch (RuntimeException e) {
            log.warn("Metric collection failed, recording empty sample: error={}", e.getMessage());
            return MetricSample.empty(now);
        }
    }

    private double cpuPercent() {
        double load = os.getCpuLoad();
        if (load < 0) {
            return 0.0;
        }
        return Math.min(100.0, load * 100.0);
    }

    // First "cpu MHz" entry of /proc/cpuinfo
    private double cpuFrequencyMhz() {
        for (String line : readLines(procRoot.resolve("cpuinfo"))) {
            if (line.startsWith("cpu MHz")) {
                int colon = line.indexOf(':');
                if (colon > 0) {
                    try {
                        return Double.parseDouble(line.substring(colon + 1).trim());
                    } catch (NumberFormatException e) {
                        return 0.0;
                    }
                }
            }
        }
        return 0.0;
    }

    private Double cpuTemperature() {
        try {
            if (!Files.isReadable(thermalZone)) {
                return null;
            }
            // millidegrees Celsius
            return Long.parseLong(Files.readString(thermalZone).trim()) / 1000.0;
        } catch (IOException | NumberFormatException e) {
            return null;
        }
    }

    private long memoryAvailable(long fallback) {
        for (String line : readLines(procRoot.resolve("meminfo"))) {
            if (line.startsWith("MemAvailable:")) {
                String[] parts = line.split("\\s+");
                try {
                    return Long.parseLong(parts[1]) * 1024L;
                } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                    return fallback;
                }
            }
        }
        return fallback;
    }

    private void collectDisk(MetricSample.Builder builder) {
        try {
            FileStore store = Files.getFileStore(diskPath);
            long total = store.getTotalSpace();
            long used = total - store.getUnallocatedSpace();
            builder.disk(total, Math.max(0, used), store.getUsableSpace());
        } catch (IOException e) {
            log.debug("Disk metrics unavailable: path={}, error={}", diskPath, e.getMessage());
        }
    }

    /**
     * Sums all interfaces of {@code /proc/net/dev}. Receive columns come first:
     * bytes, packets, then six more; transmit bytes and packets follow.
     */
    private void collectNetwork(MetricSample.Builder builder) {
        long bytesReceived = 0;
        long packetsReceived = 0;
        long bytesSent = 0;
        long packetsSent = 0;
        for (String line : readLines(procRoot.resolve("net").resolve("dev"))) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length < 10) {
                continue;
            }
            try {
                bytesReceived += Long.parseLong(fields[0]);
                packetsReceived += Long.parseLong(fields[1]);
                bytesSent += Long.parseLong(fields[8]);
                packetsSent += Long.parseLong(fields[9]);
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable /proc/net/dev line: {}", line);
            }
        }
        builder.network(bytesSent, bytesReceived, packetsSent, packetsReceived);
    }

    private List<AcceleratorMetrics> accelerators() {
        try {
            return acceleratorProbe.probe();
        } catch (RuntimeException e) {
            log.debug("Accelerator probe failed: {}", e.getMessage());
            return List.of();
        }
    }

    private int processCount() {
        try {
            return (int) ProcessHandle.allProcesses().count();
        } catch (SecurityException | UnsupportedOperationException e) {
            return 0;
        }
    }

    /**
     * Kernel boot time from {@code /proc/stat}, else JVM start time.
     */
    private Instant bootTime(Instant now) {
        for (String line : readLines(procRoot.resolve("stat"))) {
            if (line.startsWith("btime ")) {
                try {
                    return Instant.ofEpochSecond(Long.parseLong(line.substring(6).trim()));
                } catch (NumberFormatException e) {
                    break;
                }
            }
        }
        return now.minusMillis(ManagementFactory.getRuntimeMXBean().getUptime());
    }

    private static List<String> readLines(Path file) {
        try {
            return Files.isReadable(file) ? Files.readAllLines(file) : List.of();
        } catch (IOException e) {
            return List.of();
        }
    }
}
