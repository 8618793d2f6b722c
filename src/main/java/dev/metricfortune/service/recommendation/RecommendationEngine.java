package dev.metricfortune.service.recommendation;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.GenerationRequest;
import dev.metricfortune.dto.GenerationResult;
import dev.metricfortune.entity.InsightLevel;
import dev.metricfortune.entity.Pattern;
import dev.metricfortune.entity.PatternMetadata;
import dev.metricfortune.entity.Recommendation;
import dev.metricfortune.entity.RecommendationStatus;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.repository.RecommendationRepository;
import dev.metricfortune.service.IdService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a site's recent patterns into at most {@code maxRecommendations} ranked recommendations
 * for its business.
 *
 * <p>Candidates are keyed by {@code businessId:patternType:patternKey}. Within a run only the
 * best candidate per key survives; across runs a key is not re-created while a NEW recommendation
 * with that key exists. Open keys are dropped before truncation so they never take a slot. Ranking is by {@code severity x conversion weight}, newest pattern first on ties.</p>
 */
@Service
@Slf4j
public class RecommendationEngine {

    private final PatternRepository patternRepository;
    private final RecommendationRepository recommendationRepository;
    private final PeerSuccessService peerSuccessService;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final int defaultWindowDays;
    private final double defaultMinSeverity;
    private final int defaultMaxRecommendations;
    private final boolean defaultIncludePeerData;

    record Candidate(Recommendation recommendation, double impactScore, LocalDateTime detectedAt) {

        String key() {
            return recommendation.getRecommendationKey();
        }
    }

    static final Comparator<Candidate> BY_IMPACT = Comparator
            .comparingDouble(Candidate::impactScore).reversed()
            .thenComparing(Candidate::detectedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private enum Outcome { STORED, SKIPPED, FAILED }

    private record PersistOutcome(Outcome outcome, String error) {}

    public RecommendationEngine(PatternRepository patternRepository,
                                RecommendationRepository recommendationRepository,
                                PeerSuccessService peerSuccessService,
                                IdService idService,
                                ResilienceConfig resilience,
                                PipelineMetrics metrics,
                                Clock clock,
                                @Value("${insights.recommendations.window-days:7}") int defaultWindowDays,
                                @Value("${insights.recommendations.min-severity:0.3}") double defaultMinSeverity,
                                @Value("${insights.recommendations.max-count:5}") int defaultMaxRecommendations,
                                @Value("${insights.recommendations.include-peer-data:true}") boolean defaultIncludePeerData) {
        this.patternRepository = patternRepository;
        this.recommendationRepository = recommendationRepository;
        this.peerSuccessService = peerSuccessService;
        this.idService = idService;
        this.resilience = resilience;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultWindowDays = defaultWindowDays;
        this.defaultMinSeverity = defaultMinSeverity;
        this.defaultMaxRecommendations = defaultMaxRecommendations;
        this.defaultIncludePeerData = defaultIncludePeerData;
    }

    /**
     * Generates and stores recommendations. Never errors: failures are reported in the result.
     */
    public Mono<GenerationResult> generate(GenerationRequest request) {
        long started = System.currentTimeMillis();
        Long businessId = request.businessId();
        String siteId = request.siteId();
        int windowDays = request.windowDays() != null ? request.windowDays() : defaultWindowDays;
        double minSeverity = request.minSeverity() != null ? request.minSeverity() : defaultMinSeverity;
        int max = request.maxRecommendations() != null ? request.maxRecommendations() : defaultMaxRecommendations;
        boolean includePeerData = request.includePeerData() != null ? request.includePeerData() : defaultIncludePeerData;
        LocalDateTime since = LocalDateTime.now(clock).minusDays(windowDays);

        Mono<List<Pattern>> patternsMono = patternRepository.findSignificantSince(siteId, since, minSeverity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());
        Mono<Set<String>> openKeysMono = recommendationRepository.findOpenRecommendationKeys(businessId)
                .collect(Collectors.toSet())
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());

        return Mono.zip(patternsMono, openKeysMono)
                .flatMap(loaded -> {
                    List<Pattern> patterns = loaded.getT1();
                    Set<String> openKeys = loaded.getT2();
                    log.debug("Found {} patterns for site {} since {}", patterns.size(), siteId, since);
                    List<Candidate> candidates = patterns.stream()
                            .map(pattern -> toCandidate(businessId, pattern))
                            .flatMap(Optional::stream)
                            .toList();
                    long alreadyOpen = candidates.stream()
                            .map(Candidate::key)
                            .filter(openKeys::contains)
                            .distinct()
                            .count();
                    List<Candidate> ranked = rank(candidates.stream()
                            .filter(candidate -> !openKeys.contains(candidate.key()))
                            .toList(), max);
                    return Flux.fromIterable(ranked)
                            .concatMap(candidate -> persist(candidate, includePeerData))
                            .collectList()
                            .map(outcomes -> summarize(businessId, siteId, patterns.size(), ranked.size(),
                                    (int) alreadyOpen, outcomes, started));
                })
                .doOnNext(result -> {
                    metrics.recordRecommendationsCreated(result.stored());
                    log.info("Generated {} recommendations for business {} ({} stored, {} already open) in {}ms",
                            result.generated(), businessId, result.stored(), result.skipped(), result.executionTimeMs());
                })
                .onErrorResume(e -> {
                    log.error("Recommendation generation failed for business {}: {}", businessId, e.getMessage(), e);
                    return Mono.just(new GenerationResult(businessId, siteId, 0, 0, 0, 0,
                            List.of(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()),
                            System.currentTimeMillis() - started));
                });
    }

    /**
     * Keeps the best candidate per key, orders by impact score then newest detection, truncates to {@code max}.
     */
    static List<Candidate> rank(List<Candidate> candidates, int max) {
        Map<String, Candidate> best = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            best.merge(candidate.key(), candidate, (a, b) -> BY_IMPACT.compare(a, b) <= 0 ? a : b);
        }
        return best.values().stream()
                .sorted(BY_IMPACT)
                .limit(Math.max(0, max))
                .toList();
    }

    Optional<Candidate> toCandidate(Long businessId, Pattern pattern) {
        PatternMetadata metadata = pattern.getMetadata();
        if (metadata == null) {
            log.warn("Pattern {} has no metadata, skipping", pattern.getId());
            return Optional.empty();
        }
        RecommendationRule rule = RecommendationRules.ruleFor(metadata);
        Recommendation recommendation = Recommendation.builder()
                .id(idService.nextId())
                .businessId(businessId)
                .siteId(pattern.getSiteId())
                .recommendationKey(recommendationKey(businessId, pattern))
                .title(rule.title(metadata))
                .problemStatement(rule.problem(metadata))
                .actionSteps(rule.actionSteps().toArray(String[]::new))
                .expectedImpact(rule.expectedImpact(metadata))
                .impactLevel(InsightLevel.forSeverity(pattern.getSeverity()).name())
                .confidenceLevel(InsightLevel.forConfidence(pattern.getConfidenceScore()).name())
                .status(RecommendationStatus.NEW.name())
                .createdAt(LocalDateTime.now(clock))
                .build();
        return Optional.of(new Candidate(recommendation,
                rule.conversionWeight().impactScore(pattern.getSeverity()), pattern.getDetectedAt()));
    }

    public static String recommendationKey(Long businessId, Pattern pattern) {
        return businessId + ":" + pattern.getPatternType() + ":" + pattern.getPatternKey();
    }

    private Mono<PersistOutcome> persist(Candidate candidate, boolean includePeerData) {
        Recommendation recommendation = candidate.recommendation();
        return withPeerData(recommendation, includePeerData)
                .flatMap(recommendationRepository::save)
                .thenReturn(new PersistOutcome(Outcome.STORED, null))
                // concurrent run won the partial unique index
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.debug("Open recommendation {} was created concurrently, skipping", recommendation.getRecommendationKey());
                    return Mono.just(new PersistOutcome(Outcome.SKIPPED, null));
                })
                .onErrorResume(e -> {
                    log.warn("Failed to store recommendation {}: {}", recommendation.getRecommendationKey(), e.getMessage());
                    return Mono.just(new PersistOutcome(Outcome.FAILED,
                            "Failed to store " + recommendation.getRecommendationKey() + ": " + e.getMessage()));
                });
    }

    private Mono<Recommendation> withPeerData(Recommendation recommendation, boolean includePeerData) {
        if (!includePeerData) {
            return Mono.just(recommendation);
        }
        return peerSuccessService.peerSuccess(recommendation.getBusinessId(), recommendation.getTitle())
                .map(stats -> {
                    recommendation.setPeerSuccessData(stats.narrative());
                    return recommendation;
                })
                .defaultIfEmpty(recommendation);
    }

    private GenerationResult summarize(Long businessId, String siteId, int patterns, int generated,
                                       int alreadyOpen, List<PersistOutcome> outcomes, long started) {
        int stored = 0;
        int skipped = alreadyOpen;
        List<String> errors = new ArrayList<>();
        for (PersistOutcome outcome : outcomes) {
            switch (outcome.outcome()) {
                case STORED -> stored++;
                case SKIPPED -> skipped++;
                case FAILED -> errors.add(outcome.error());
            }
        }
        return new GenerationResult(businessId, siteId, patterns, generated, stored, skipped,
                List.copyOf(errors), System.currentTimeMillis() - started);
    }
}
