package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import fr.lapetina.modelhost.domain.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SystemMetricSamplerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path root;

    private Path proc;

    @BeforeEach
    void setUp() throws IOException {
        proc = Files.createDirectories(root.resolve("proc"));
        Files.createDirectories(proc.resolve("net"));
        Files.writeString(proc.resolve("cpuinfo"), "processor\t: 0\ncpu MHz\t\t: 2400.125\n");
        Files.writeString(proc.resolve("stat"), "cpu  1 2 3\nbtime " + NOW.minusSeconds(7200).getEpochSecond() + "\n");
        Files.writeString(proc.resolve("net").resolve("dev"),
                "Inter-|   Receive                            |  Transmit\n"
                + " face |bytes    packets errs drop fifo frame compressed multicast|bytes    packets\n"
                + "    lo:  1000      10    0    0    0     0          0         0     1000      10    0    0    0     0       0          0\n"
                + "  eth0:  5000      50    0    0    0     0          0         0     2000      20    0    0    0     0       0          0\n");
    }

    private SystemMetricSampler sampler(Path thermal, AcceleratorProbe probe) {
        return new SystemMetricSampler(root, probe, proc, thermal, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should read frequency, boot time and network totals from proc files")
    void shouldReadProcFiles() {
        MetricSample sample = sampler(root.resolve("no-thermal"), AcceleratorProbe.none()).collect();

        assertThat(sample.timestamp()).isEqualTo(NOW);
        assertThat(sample.cpuFrequencyMhz()).isEqualTo(2400.125);
        assertThat(sample.uptime().toHours()).isEqualTo(2);
        assertThat(sample.networkBytesReceived()).isEqualTo(6000);
        assertThat(sample.networkBytesSent()).isEqualTo(3000);
        assertThat(sample.networkPacketsReceived()).isEqualTo(60);
        assertThat(sample.networkPacketsSent()).isEqualTo(30);
        assertThat(sample.cpuTemperature()).isEmpty();
        assertThat(sample.cpuCount()).isPositive();
        assertThat(sample.diskTotalBytes()).isPositive();
        assertThat(sample.cpuPercent()).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("should convert the thermal zone reading from millidegrees")
    void shouldReadTemperature() throws IOException {
        Path thermal = Files.writeString(root.resolve("temp"), "54500\n");

        MetricSample sample = sampler(thermal, AcceleratorProbe.none()).collect();

        assertThat(sample.cpuTemperature()).hasValue(54.5);
    }

    @Test
    @DisplayName("should include accelerators and tolerate a failing probe")
    void shouldIncludeAccelerators() {
        AcceleratorMetrics gpu = new AcceleratorMetrics(0, "gpu0", 1000, 500, 20);
        MetricSample withGpu = sampler(root.resolve("none"), () -> List.of(gpu)).collect();
        MetricSample failingProbe = sampler(root.resolve("none"), () -> {
            throw new IllegalStateException("driver crashed");
        }).collect();

        assertThat(withGpu.accelerators()).containsExactly(gpu);
        assertThat(failingProbe.accelerators()).isEmpty();
        assertThat(failingProbe.timestamp()).isEqualTo(NOW);
    }
}
