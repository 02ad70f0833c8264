/**
 * LMAX Disruptor hand-off between the telemetry sampler and its consumers.
 *
 * <p>The sampler thread publishes each sample into a pre-allocated ring buffer and
 * returns immediately; consumer threads append it to the
 * {@link fr.lapetina.modelhost.telemetry.TelemetryStore} and refresh the Micrometer gauges.
 * A slow consumer therefore never delays sampling: when the ring is full the sample is dropped
 * and counted.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Recording → Gauges
 * </pre>
 *
 * @see fr.lapetina.modelhost.disruptor.TelemetryPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.modelhost.disruptor;
