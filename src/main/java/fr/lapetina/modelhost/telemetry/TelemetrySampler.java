package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background sampler: collects one sample per interval and hands it to a sink.
 *
 * Runs on a single daemon thread. When collection fails an empty sample is
 * recorded in its place and the schedule continues. {@link #close()} cancels the schedule and waits at most the
 * configured grace period before interrupting the thread.
 */
public final class TelemetrySampler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetrySampler.class);

    private final MetricSource source;
    private final Consumer<MetricSample> sink;
    private final Duration interval;
    private final Duration shutdownGrace;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> schedule;

    public TelemetrySampler(
            MetricSource source,
            Consumer<MetricSample> sink,
            Duration interval,
            Duration shutdownGrace
    ) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        this.source = source;
        this.sink = sink;
        this.interval = interval;
        this.shutdownGrace = shutdownGrace;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "telemetry-sampler");
            t.setDaemon(true);
            return t;
        });
    }

    public TelemetrySampler(MetricSource source, Consumer<MetricSample> sink) {
        this(source, sink, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    /**
     * Starts periodic sampling. A second call is a no-op.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            schedule = scheduler.scheduleWithFixedDelay(
                    this::tick,
                    0,
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Telemetry sampler started with interval: {}", interval);
        } else {
            log.warn("Telemetry sampler is already running");
        }
    }

    /**
     * Collects a fresh sample on the calling thread without recording it.
     */
    public MetricSample current() {
        return source.collect();
    }

    private void tick() {
        MetricSample sample;
        try {
            sample = source.collect();
        } catch (RuntimeException e) {
            log.error("Telemetry collection failed, recording an empty sample", e);
            sample = MetricSample.empty(Instant.now());
        }
        try {
            sink.accept(sample);
            log.debug("Collected telemetry sample: cpuPercent={}, memoryPercent={}",
                    sample.cpuPercent(), sample.memoryPercent());
        } catch (RuntimeException e) {
            // Must not escape: an exception would cancel the schedule
            log.error("Error in telemetry sampling tick", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> current = schedule;
            if (current != null) {
                current.cancel(false);
            }
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Telemetry sampler did not stop within {}, interrupting", shutdownGrace);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Telemetry sampler stopped");
    }
}
