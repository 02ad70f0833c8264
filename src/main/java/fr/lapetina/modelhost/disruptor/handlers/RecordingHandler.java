package fr.lapetina.modelhost.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modelhost.domain.event.SampleEvent;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage: appends the sample to the telemetry store.
 */
public final class RecordingHandler implements EventHandler<SampleEvent> {

    private static final Logger log = LoggerFactory.getLogger(RecordingHandler.class);

    private final TelemetryStore store;

    public RecordingHandler(TelemetryStore store) {
        this.store = store;
    }

    @Override
    public void onEvent(SampleEvent event, long sequence, boolean endOfBatch) {
        if (event.getSample() == null) {
            return;
        }
        store.append(event.getSample());
        event.markRecorded();

        log.debug("Sample recorded: sequence={}, cpuPercent={}, memoryPercent={}, historySize={}",
                sequence, event.getSample().cpuPercent(), event.getSample().memoryPercent(), store.size());
    }
}
