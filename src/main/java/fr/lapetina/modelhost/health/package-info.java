/**
 * On-demand health aggregation.
 *
 * <p>Four {@link fr.lapetina.modelhost.health.HealthCheck}s (system, resources, telemetry and
 * service) each produce a report; {@link fr.lapetina.modelhost.health.HealthAggregator} reduces
 * them to the worst severity and asks the
 * {@link fr.lapetina.modelhost.health.RecommendationEngine} for suggestions.
 */
package fr.lapetina.modelhost.health;
