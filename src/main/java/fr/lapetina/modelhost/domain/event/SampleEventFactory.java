package fr.lapetina.modelhost.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link SampleEvent} slots for the telemetry ring buffer.
 */
public final class SampleEventFactory implements EventFactory<SampleEvent> {

    @Override
    public SampleEvent newInstance() {
        return new SampleEvent();
    }
}
