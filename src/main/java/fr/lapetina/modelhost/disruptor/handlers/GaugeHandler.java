package fr.lapetina.modelhost.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modelhost.domain.event.SampleEvent;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;

/**
 * Last stage: publishes the recorded sample to the Micrometer gauges and
 * releases the slot for reuse.
 */
public final class GaugeHandler implements EventHandler<SampleEvent> {

    private final MetricsRegistry metricsRegistry;

    public GaugeHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(SampleEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.isRecorded()) {
                metricsRegistry.recordSample(event.getSample());
            }
        } finally {
            event.clear();
        }
    }
}
