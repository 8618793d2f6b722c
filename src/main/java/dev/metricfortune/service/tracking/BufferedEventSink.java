package dev.metricfortune.service.tracking;

import dev.metricfortune.entity.TrackingEvent;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Hands events to the {@link EventBuffer}; completes as soon as they are queued.
 */
@RequiredArgsConstructor
public class BufferedEventSink implements EventSink {

    private final EventBuffer buffer;

    @Override
    public Mono<Void> submit(List<TrackingEvent> events) {
        return Mono.fromRunnable(() -> buffer.addBatch(events));
    }
}
