package dev.metricfortune.service.recommendation;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.ImplementRecommendationRequest;
import dev.metricfortune.dto.RecommendationFilter;
import dev.metricfortune.dto.RecommendationResponse;
import dev.metricfortune.entity.InsightLevel;
import dev.metricfortune.entity.Recommendation;
import dev.metricfortune.entity.RecommendationStatus;
import dev.metricfortune.exception.InvalidStatusTransitionException;
import dev.metricfortune.exception.ResourceNotFoundException;
import dev.metricfortune.repository.RecommendationRepository;
import dev.metricfortune.service.BusinessAccessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Owner-scoped reads and status transitions of stored recommendations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final RecommendationRepository recommendationRepository;
    private final BusinessAccessService businessAccessService;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Flux<RecommendationResponse> list(Long businessId, String userId, RecommendationFilter filter) {
        if (filter.getLimit() < 1 || filter.getLimit() > RecommendationFilter.MAX_LIMIT) {
            return Flux.error(new IllegalArgumentException("error.invalid_limit"));
        }
        if (!isStatus(filter.getStatus()) || !isLevel(filter.getImpactLevel()) || !isLevel(filter.getConfidenceLevel())) {
            return Flux.error(new IllegalArgumentException("error.invalid_filter"));
        }

        return businessAccessService.requireOwned(businessId, userId)
                .flatMapMany(business -> recommendationRepository.findByBusinessId(business.getId()))
                .filter(r -> filter.getStatus() == null || filter.getStatus().equals(r.getStatus()))
                .filter(r -> filter.getImpactLevel() == null || filter.getImpactLevel().equals(r.getImpactLevel()))
                .filter(r -> filter.getConfidenceLevel() == null || filter.getConfidenceLevel().equals(r.getConfidenceLevel()))
                .sort(RecommendationRanking.forSort(filter.getSortBy(), filter.getSortOrder()))
                .take(filter.getLimit())
                .map(RecommendationResponse::from);
    }

    public Mono<RecommendationResponse> get(Long id, String userId) {
        return findOwned(id, userId).map(RecommendationResponse::from);
    }

    public Mono<RecommendationResponse> plan(Long id, String userId) {
        return transition(id, userId, RecommendationStatus.PLANNED,
                r -> r.setPlannedAt(LocalDateTime.now(clock)));
    }

    public Mono<RecommendationResponse> implement(Long id, String userId, ImplementRecommendationRequest request) {
        LocalDateTime implementedAt = request.getImplementedAt();
        if (implementedAt == null || implementedAt.isAfter(LocalDateTime.now(clock))) {
            return Mono.error(new IllegalArgumentException("error.implemented_at_future"));
        }
        String notes = request.getNotes();
        if (notes != null && notes.length() > Recommendation.MAX_NOTES_LENGTH) {
            return Mono.error(new IllegalArgumentException("error.notes_too_long"));
        }
        return transition(id, userId, RecommendationStatus.IMPLEMENTED, r -> {
            r.setImplementedAt(implementedAt);
            if (notes != null && !notes.isBlank()) {
                r.setImplementationNotes(notes.trim());
            }
        });
    }

    public Mono<RecommendationResponse> dismiss(Long id, String userId) {
        return transition(id, userId, RecommendationStatus.DISMISSED,
                r -> r.setDismissedAt(LocalDateTime.now(clock)));
    }

    private Mono<RecommendationResponse> transition(Long id, String userId, RecommendationStatus target,
                                                    Consumer<Recommendation> apply) {
        return findOwned(id, userId)
                .flatMap(recommendation -> {
                    RecommendationStatus current = RecommendationStatus.from(recommendation.getStatus());
                    if (!current.canTransitionTo(target)) {
                        return Mono.error(new InvalidStatusTransitionException(current, target));
                    }
                    recommendation.setStatus(target.name());
                    apply.accept(recommendation);
                    return recommendationRepository.save(recommendation)
                            .timeout(resilience.getDatabaseTimeout())
                            .retryWhen(resilience.databaseRetry());
                })
                .doOnNext(saved -> log.info("Recommendation {} moved to {}", saved.getId(), saved.getStatus()))
                .map(RecommendationResponse::from);
    }

    private Mono<Recommendation> findOwned(Long id, String userId) {
        return recommendationRepository.findById(id)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.recommendation_not_found")))
                .flatMap(recommendation -> businessAccessService.requireOwned(recommendation.getBusinessId(), userId)
                        .onErrorMap(ResourceNotFoundException.class,
                                e -> new ResourceNotFoundException("error.recommendation_not_found"))
                        .thenReturn(recommendation));
    }

    private static boolean isStatus(String value) {
        return value == null || Arrays.stream(RecommendationStatus.values()).anyMatch(s -> s.matches(value));
    }

    private static boolean isLevel(String value) {
        return value == null || Arrays.stream(InsightLevel.values()).anyMatch(l -> l.matches(value));
    }
}
