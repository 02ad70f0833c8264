package fr.lapetina.modelhost.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.modelhost.disruptor.handlers.GaugeHandler;
import fr.lapetina.modelhost.disruptor.handlers.RecordingHandler;
import fr.lapetina.modelhost.domain.event.SampleEvent;
import fr.lapetina.modelhost.domain.event.SampleEventFactory;
import fr.lapetina.modelhost.domain.model.MetricSample;
import fr.lapetina.modelhost.infrastructure.config.ServiceConfig;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands telemetry samples from the sampler thread to their consumers.
 *
 * The sampler never blocks on consumers: {@link #publish(MetricSample)} claims a
 * slot with {@code tryNext} and drops the sample when the ring is full.
 *
 * Stages, in order:
 * <pre>
 * Recording (append to the store) -> Gauges (Micrometer, slot release)
 * </pre>
 *
 * PRODUCER TYPE: SINGLE. Only the sampler thread publishes.
 * WAIT STRATEGY: configurable, default blocking; samples arrive every few
 * seconds so spinning consumers would only burn CPU.
 */
public final class TelemetryPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

    private final Disruptor<SampleEvent> disruptor;
    private final RingBuffer<SampleEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private TelemetryPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new SampleEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("telemetry-handler"),
                ProducerType.SINGLE,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new RecordingHandler(builder.store))
                .then(new GaugeHandler(builder.metricsRegistry));

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("TelemetryPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("TelemetryPipeline started");
        }
    }

    /**
     * Publishes a sample without blocking.
     *
     * @return false if the pipeline is not running or the ring buffer is full
     */
    public boolean publish(MetricSample sample) {
        if (!running.get()) {
            return false;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            metricsRegistry.incrementSamplesDropped();
            log.warn("Telemetry ring buffer full, dropping sample: timestamp={}", sample.timestamp());
            return false;
        }

        try {
            ringBuffer.get(sequence).initialize(sample, Instant.now());
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        return true;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains published samples, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down TelemetryPipeline...");
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("TelemetryPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("TelemetryPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs handler failures and keeps the pipeline running.
     */
    private static class PipelineExceptionHandler implements com.lmax.disruptor.ExceptionHandler<SampleEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, SampleEvent event) {
            log.error("Exception in telemetry handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during telemetry pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during telemetry pipeline shutdown", ex);
        }
    }

    /**
     * Builder for TelemetryPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";
        private TelemetryStore store;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder store(TelemetryStore store) {
            this.store = store;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ServiceConfig config) {
            return ringBufferSize(config.getDisruptor().getRingBufferSize())
                    .waitStrategy(config.getDisruptor().getWaitStrategy());
        }

        public TelemetryPipeline build() {
            if (store == null) {
                throw new IllegalStateException("TelemetryStore is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new TelemetryPipeline(this);
        }
    }
}
