package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads NVIDIA accelerators through {@code nvidia-smi}.
 *
 * Memory figures are reported in MiB and converted to bytes.
 */
public final class NvidiaSmiProbe implements AcceleratorProbe {

    private static final Logger log = LoggerFactory.getLogger(NvidiaSmiProbe.class);

    private static final long MIB = 1024L * 1024L;

    private final String command;
    private final Duration timeout;
    private volatile boolean missingLogged;

    public NvidiaSmiProbe(String command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    public NvidiaSmiProbe() {
        this("nvidia-smi", Duration.ofSeconds(2));
    }

    @Override
    public List<AcceleratorMetrics> probe() {
        Process process = null;
        try {
            process = new ProcessBuilder(command,
                    "--query-gpu=index,name,memory.total,memory.used,utilization.gpu",
                    "--format=csv,noheader,nounits")
                    .redirectErrorStream(true)
                    .start();

            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lines.add(line);
                }
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("nvidia-smi timed out after {} ms", timeout.toMillis());
                return List.of();
            }
            if (process.exitValue() != 0) {
                return List.of();
            }
            return parse(lines);

        } catch (IOException e) {
            if (!missingLogged) {
                missingLogged = true;
                log.debug("nvidia-smi not available: {}", e.getMessage());
            }
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    /**
     * Parses {@code index, name, memory.total, memory.used, utilization.gpu} lines.
     * Malformed lines are skipped.
     */
    static List<AcceleratorMetrics> parse(List<String> lines) {
        List<AcceleratorMetrics> result = new ArrayList<>();
        for (String line : lines) {
            String[] fields = line.split(",");
            if (fields.length < 5) {
                continue;
            }
            try {
                result.add(new AcceleratorMetrics(
                        Integer.parseInt(fields[0].trim()),
                        fields[1].trim(),
                        (long) (Double.parseDouble(fields[2].trim()) * MIB),
                        (long) (Double.parseDouble(fields[3].trim()) * MIB),
                        Double.parseDouble(fields[4].trim())
                ));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable nvidia-smi line: {}", line);
            }
        }
        return result;
    }
}
