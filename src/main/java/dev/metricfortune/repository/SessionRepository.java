package dev.metricfortune.repository;

import dev.metricfortune.entity.Session;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

/**
 * Sessions are written by the upstream session materializer; this service only reads them.
 */
@Repository
public interface SessionRepository extends ReactiveCrudRepository<Session, Long> {

    @Query("SELECT * FROM sessions WHERE site_id = :siteId AND created_at >= :from AND created_at <= :to")
    Flux<Session> findInWindow(String siteId, LocalDateTime from, LocalDateTime to);

    @Query("SELECT * FROM sessions WHERE site_id = :siteId ORDER BY created_at DESC LIMIT :limit")
    Flux<Session> findLatestBySiteId(String siteId, int limit);
}
