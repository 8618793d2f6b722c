package dev.metricfortune.repository;

import dev.metricfortune.entity.Recommendation;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface RecommendationRepository extends ReactiveCrudRepository<Recommendation, Long> {

    Flux<Recommendation> findByBusinessId(Long businessId);

    @Query("SELECT recommendation_key FROM recommendations WHERE business_id = :businessId AND status = 'NEW'")
    Flux<String> findOpenRecommendationKeys(Long businessId);

    @Query("SELECT * FROM recommendations WHERE business_id = ANY(:businessIds) AND status = 'IMPLEMENTED' " +
           "AND title ILIKE :titlePattern")
    Flux<Recommendation> findImplementedByTitleLike(Long[] businessIds, String titlePattern);
}
