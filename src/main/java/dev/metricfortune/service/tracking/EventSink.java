package dev.metricfortune.service.tracking;

import dev.metricfortune.entity.TrackingEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Destination for validated tracking events. Implementations either buffer and flush
 * later ({@link BufferedEventSink}) or write before completing ({@link DirectEventSink}).
 */
public interface EventSink {

    Mono<Void> submit(List<TrackingEvent> events);
}
