package fr.lapetina.modelhost.domain.event;

import fr.lapetina.modelhost.domain.model.MetricSample;

import java.time.Instant;

/**
 * Event object for the telemetry ring buffer.
 *
 * Mutable holder reused across the ring buffer. It must never be accessed
 * outside the pipeline handlers; the sample it carries is immutable and may
 * be kept.
 */
public final class SampleEvent {

    private MetricSample sample;
    private Instant publishedAt;
    private boolean recorded;

    public void clear() {
        this.sample = null;
        this.publishedAt = null;
        this.recorded = false;
    }

    public void initialize(MetricSample sample, Instant publishedAt) {
        clear();
        this.sample = sample;
        this.publishedAt = publishedAt;
    }

    public MetricSample getSample() {
        return sample;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public boolean isRecorded() {
        return recorded;
    }

    public void markRecorded() {
        this.recorded = true;
    }

    @Override
    public String toString() {
        return "SampleEvent{timestamp=" + (sample != null ? sample.timestamp() : null)
                + ", recorded=" + recorded + "}";
    }
}
