package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads AMD accelerators from the amdgpu sysfs interface
 * ({@code /sys/class/drm/card*}/device).
 */
public final class AmdSysfsProbe implements AcceleratorProbe {

    private static final Logger log = LoggerFactory.getLogger(AmdSysfsProbe.class);

    private final Path drmRoot;

    public AmdSysfsProbe(Path drmRoot) {
        this.drmRoot = drmRoot;
    }

    public AmdSysfsProbe() {
        this(Paths.get("/sys/class/drm"));
    }

    @Override
    public List<AcceleratorMetrics> probe() {
        if (!Files.isDirectory(drmRoot)) {
            return List.of();
        }
        List<AcceleratorMetrics> result = new ArrayList<>();
        try (DirectoryStream<Path> cards = Files.newDirectoryStream(drmRoot, "card[0-9]*")) {
            for (Path card : cards) {
                Path device = card.resolve("device");
                Path total = device.resolve("mem_info_vram_total");
                if (!Files.isReadable(total)) {
                    continue;
                }
                int index = parseIndex(card.getFileName().toString());
                if (index < 0) {
                    continue;
                }
                result.add(new AcceleratorMetrics(
                        index,
                        "AMD GPU " + index,
                        readLong(total),
                        readLong(device.resolve("mem_info_vram_used")),
                        readLong(device.resolve("gpu_busy_percent"))
                ));
            }
        } catch (IOException e) {
            log.debug("AMD sysfs probe failed: {}", e.getMessage());
            return List.of();
        }
        result.sort((a, b) -> Integer.compare(a.id(), b.id()));
        return result;
    }

    // "card0" but not connector entries such as "card0-DP-1"
    private static int parseIndex(String name) {
        try {
            return Integer.parseInt(name.substring("card".length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long readLong(Path file) {
        try {
            return Long.parseLong(Files.readString(file).trim());
        } catch (IOException | NumberFormatException e) {
            return 0L;
        }
    }
}
