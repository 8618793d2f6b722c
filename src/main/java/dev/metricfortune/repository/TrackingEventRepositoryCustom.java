package dev.metricfortune.repository;

import dev.metricfortune.dto.FormInteraction;
import dev.metricfortune.entity.TrackingEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Bulk and projection queries for tracking events, see {@link TrackingEventRepositoryImpl}.
 */
public interface TrackingEventRepositoryCustom {

    /**
     * Multi-row insert; rows whose id already exists are skipped.
     *
     * @return number of rows actually inserted
     */
    Mono<Long> insertAllSkipDuplicates(List<TrackingEvent> events);

    /**
     * Form events of a site within {@code [from, to]}, ordered by session then time.
     */
    Flux<FormInteraction> findFormInteractions(String siteId, LocalDateTime from, LocalDateTime to);
}
