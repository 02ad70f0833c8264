/**
 * Host telemetry: sampling, bounded history and derived statistics.
 *
 * <p>{@link fr.lapetina.modelhost.telemetry.SystemMetricSampler} reads the platform management
 * bean, {@code /proc} and {@code /sys}; accelerators come from
 * {@link fr.lapetina.modelhost.telemetry.NvidiaSmiProbe} or
 * {@link fr.lapetina.modelhost.telemetry.AmdSysfsProbe}. The
 * {@link fr.lapetina.modelhost.telemetry.TelemetrySampler} runs collection on a schedule and
 * the {@link fr.lapetina.modelhost.telemetry.TelemetryStore} keeps the most recent samples.
 */
package fr.lapetina.modelhost.telemetry;
