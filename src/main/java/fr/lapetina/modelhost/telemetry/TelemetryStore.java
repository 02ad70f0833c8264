package fr.lapetina.modelhost.telemetry;

import fr.lapetina.modelhost.domain.model.MetricSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity FIFO of metric samples. When full, appending evicts the oldest.
 *
 * Thread-safety: all access goes through the instance monitor, so append and
 * eviction are atomic with respect to readers. Readers get copies.
 */
public final class TelemetryStore {

    private final int capacity;
    private final Clock clock;
    private final ArrayDeque<MetricSample> samples;

    public TelemetryStore(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public TelemetryStore(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void append(MetricSample sample) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(sample);
    }

    /**
     * All samples, oldest first.
     */
    public synchronized List<MetricSample> history() {
        return new ArrayList<>(samples);
    }

    /**
     * The last {@code limit} samples, oldest first. A non-positive limit returns everything.
     */
    public synchronized List<MetricSample> history(int limit) {
        if (limit <= 0 || limit >= samples.size()) {
            return new ArrayList<>(samples);
        }
        List<MetricSample> tail = new ArrayList<>(limit);
        Iterator<MetricSample> it = samples.descendingIterator();
        while (it.hasNext() && tail.size() < limit) {
            tail.add(it.next());
        }
        java.util.Collections.reverse(tail);
        return tail;
    }

    public synchronized Optional<MetricSample> latest() {
        return Optional.ofNullable(samples.peekLast());
    }

    /**
     * Means over samples taken within {@code [now - window, now]}; empty when none qualify.
     */
    public Optional<MetricAverage> averageOver(Duration window) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        List<MetricSample> relevant = history().stream()
                .filter(s -> !s.timestamp().isBefore(cutoff) && !s.timestamp().isAfter(now))
                .toList();
        if (relevant.isEmpty()) {
            return Optional.empty();
        }

        double cpu = 0;
        double memory = 0;
        double disk = 0;
        for (MetricSample sample : relevant) {
            cpu += sample.cpuPercent();
            memory += sample.memoryPercent();
            disk += sample.diskPercent();
        }
        int n = relevant.size();

        // Sum of per-interval increases; an interval where a counter went backwards adds nothing
        long sent = 0;
        long received = 0;
        for (int i = 1; i < n; i++) {
            MetricSample previous = relevant.get(i - 1);
            MetricSample current = relevant.get(i);
            sent += increase(previous.networkBytesSent(), current.networkBytesSent());
            received += increase(previous.networkBytesReceived(), current.networkBytesReceived());
        }
        double seconds = Duration.between(relevant.get(0).timestamp(), relevant.get(n - 1).timestamp())
                .toMillis() / 1000.0;

        return Optional.of(MetricAverage.of(window, n, cpu / n, memory / n, disk / n,
                rate(sent, seconds), rate(received, seconds)));
    }

    /**
     * Newest minus oldest CPU and memory percent over the last {@code windowCount} samples.
     * Empty with fewer than two samples.
     *
     * @throws IllegalArgumentException if {@code windowCount} is below 2
     */
    public Optional<MetricTrend> trend(int windowCount) {
        if (windowCount < 2) {
            throw new IllegalArgumentException("Trend window must be at least 2 samples: " + windowCount);
        }
        List<MetricSample> window = history(windowCount);
        if (window.size() < 2) {
            return Optional.empty();
        }
        MetricSample oldest = window.get(0);
        MetricSample newest = window.get(window.size() - 1);
        return Optional.of(new MetricTrend(
                window.size(),
                newest.cpuPercent() - oldest.cpuPercent(),
                newest.memoryPercent() - oldest.memoryPercent()));
    }

    public synchronized int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        samples.clear();
    }

    private static long increase(long from, long to) {
        return to >= from ? to - from : 0;
    }

    private static double rate(long bytes, double seconds) {
        return seconds > 0 ? bytes / seconds : 0.0;
    }
}
