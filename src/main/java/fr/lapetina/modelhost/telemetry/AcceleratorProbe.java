package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;

import java.util.List;

/**
 * Best-effort source of accelerator metrics.
 *
 * Implementations never throw: a missing device, driver or management tool
 * yields an empty list.
 */
@FunctionalInterface
public interface AcceleratorProbe {

    List<AcceleratorMetrics> probe();

    default boolean isAvailable() {
        return !probe().isEmpty();
    }

    /**
     * Probe for hosts without accelerators.
     */
    static AcceleratorProbe none() {
        return List::of;
    }

    /**
     * Returns the first probe that reports at least one accelerator.
     */
    static AcceleratorProbe firstAvailable(AcceleratorProbe... probes) {
        return () -> {
            for (AcceleratorProbe probe : probes) {
                List<AcceleratorMetrics> found = probe.probe();
                if (!found.isEmpty()) {
                    return found;
                }
            }
            return List.of();
        };
    }
}
