package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.MetricSample;

/**
 * Produces one metric sample per call. Never throws; failed readings
 * degrade to {@link MetricSample#empty}.
 */
@FunctionalInterface
public interface MetricSource {

    MetricSample collect();
}
