package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;

/**
 * One independent health sub-check.
 *
 * Implementations may throw; {@link HealthAggregator} converts any exception
 * into an ERROR report carrying the failure text.
 */
public interface HealthCheck {

    HealthCategory category();

    HealthReport check();
}
