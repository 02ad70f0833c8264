/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing, validation and runtime updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.modelhost.infrastructure.config.ServiceConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.modelhost.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.modelhost.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only health thresholds are re-applied at runtime. Storage, server and lifecycle
 * settings take effect on restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, worker threads)</li>
 *   <li>{@code storage} - Artifact directory and catalog file</li>
 *   <li>{@code telemetry} - Sampling interval, history size, accelerator probing</li>
 *   <li>{@code lifecycle} - Download, load and unload timeouts</li>
 *   <li>{@code health} - Thresholds and history size</li>
 *   <li>{@code backend} - Model backend connection</li>
 *   <li>{@code disruptor} - Telemetry ring buffer settings</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.modelhost.infrastructure.config;
