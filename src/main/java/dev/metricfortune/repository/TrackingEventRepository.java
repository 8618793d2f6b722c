package dev.metricfortune.repository;

import dev.metricfortune.entity.TrackingEvent;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface TrackingEventRepository extends ReactiveCrudRepository<TrackingEvent, Long>, TrackingEventRepositoryCustom {

    @Modifying
    @Query("DELETE FROM tracking_events WHERE timestamp < :cutoff")
    Mono<Long> deleteOlderThan(LocalDateTime cutoff);

    @Query("SELECT COUNT(*) FROM tracking_events WHERE site_id = :siteId AND timestamp >= :since")
    Mono<Long> countBySiteIdSince(String siteId, LocalDateTime since);
}
