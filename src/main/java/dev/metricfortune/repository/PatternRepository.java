package dev.metricfortune.repository;

import dev.metricfortune.entity.Pattern;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface PatternRepository extends ReactiveCrudRepository<Pattern, Long>, PatternRepositoryCustom {

    @Query("SELECT * FROM patterns WHERE site_id = :siteId AND detected_at >= :since AND severity >= :minSeverity " +
           "ORDER BY severity DESC, detected_at DESC")
    Flux<Pattern> findSignificantSince(String siteId, LocalDateTime since, double minSeverity);

    @Query("SELECT DISTINCT site_id FROM patterns WHERE detected_at >= :since AND severity >= :minSeverity")
    Flux<String> findSiteIdsWithPatternsSince(LocalDateTime since, double minSeverity);

    @Query("SELECT * FROM patterns WHERE site_id = :siteId ORDER BY detected_at DESC, severity DESC LIMIT :limit")
    Flux<Pattern> findRecentBySiteId(String siteId, int limit);
}
