package dev.metricfortune.service.tracking;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.entity.TrackingEvent;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.TrackingEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Writes each submitted batch with one bulk insert before completing. Store failures
 * reach the caller after the retry policy gives up.
 */
@RequiredArgsConstructor
@Slf4j
public class DirectEventSink implements EventSink {

    private final TrackingEventRepository repository;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;

    @Override
    public Mono<Void> submit(List<TrackingEvent> events) {
        return repository.insertAllSkipDuplicates(events)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .doOnNext(inserted -> {
                    metrics.recordPersisted(events.size());
                    log.debug("Persisted {} events directly ({} new rows)", events.size(), inserted);
                })
                .then();
    }
}
