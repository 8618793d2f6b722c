package dev.metricfortune.health;

import dev.metricfortune.service.tracking.EventBuffer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports the number of events waiting in the ingestion buffer. Above the warning threshold the
 * status is {@code DEGRADED}: writes are lagging but nothing is lost.
 */
@Component("eventBuffer")
public class EventBufferHealthIndicator implements ReactiveHealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Event buffer above warning threshold");

    private final EventBuffer eventBuffer;
    private final int warningThreshold;

    public EventBufferHealthIndicator(EventBuffer eventBuffer,
                                      @Value("${tracking.buffer.warning-threshold:50}") int warningThreshold) {
        this.eventBuffer = eventBuffer;
        this.warningThreshold = warningThreshold;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            int size = eventBuffer.size();
            return Health.status(size > warningThreshold ? DEGRADED : Status.UP)
                    .withDetail("size", size)
                    .withDetail("warningThreshold", warningThreshold)
                    .build();
        });
    }

    public int warningThreshold() {
        return warningThreshold;
    }
}
