/**
 * Model Host - lifecycle management, telemetry and health aggregation for locally served models.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.modelhost.ServiceFactory} - Builds the whole service graph from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.modelhost.ModelHostApplication} - Standalone HTTP server</li>
 *   <li>{@link fr.lapetina.modelhost.lifecycle.LifecycleManager} - download, load and unload of
 *       catalog resources</li>
 *   <li>{@link fr.lapetina.modelhost.health.HealthAggregator} - aggregated health and
 *       recommendations</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ServiceFactory factory = ServiceFactory.create("config.yaml").start()) {
 *     LifecycleManager manager = factory.getLifecycleManager();
 *     manager.download("tinyllama", false);
 *     manager.load("tinyllama", Device.AUTO);
 *
 *     String reply = manager.get("tinyllama").orElseThrow().generate("Hello!");
 * }
 * }</pre>
 *
 * @see fr.lapetina.modelhost.ServiceFactory
 * @see fr.lapetina.modelhost.disruptor.TelemetryPipeline
 */
package fr.lapetina.modelhost;
