package dev.metricfortune.scheduler;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.GenerationRequest;
import dev.metricfortune.dto.GenerationResult;
import dev.metricfortune.exception.ResourceNotFoundException;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.service.recommendation.RecommendationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Generates recommendations for every business whose site has significant recent patterns,
 * or for a single site when one is given.
 */
@Component
@Slf4j
public class RecommendationGenerationJob {

    static final String JOB_NAME = "recommendation-generation";
    static final String LOCK_KEY = "scheduler:recommendation-generation:lock";
    private static final Duration LOCK_TTL = Duration.ofHours(1);

    private final PatternRepository patternRepository;
    private final BusinessRepository businessRepository;
    private final RecommendationEngine recommendationEngine;
    private final JobLock jobLock;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final int windowDays;
    private final double minSeverity;

    public RecommendationGenerationJob(PatternRepository patternRepository,
                                       BusinessRepository businessRepository,
                                       RecommendationEngine recommendationEngine,
                                       JobLock jobLock,
                                       ResilienceConfig resilience,
                                       PipelineMetrics metrics,
                                       Clock clock,
                                       @Value("${insights.recommendations.window-days:7}") int windowDays,
                                       @Value("${insights.recommendations.min-severity:0.3}") double minSeverity) {
        this.patternRepository = patternRepository;
        this.businessRepository = businessRepository;
        this.recommendationEngine = recommendationEngine;
        this.jobLock = jobLock;
        this.resilience = resilience;
        this.metrics = metrics;
        this.clock = clock;
        this.windowDays = windowDays;
        this.minSeverity = minSeverity;
    }

    /** Starts a run in the background, optionally scoped to one site. */
    public void trigger(String siteId) {
        run(siteId).subscribe(
                null,
                error -> log.error("Recommendation generation job failed: {}", error.getMessage(), error),
                () -> log.debug("Recommendation generation job finished")
        );
    }

    /**
     * Completes empty when another instance is already running.
     */
    public Mono<JobReport<GenerationResult>> run(String siteId) {
        return jobLock.withLock(LOCK_KEY, LOCK_TTL, () -> generate(siteId));
    }

    Mono<JobReport<GenerationResult>> generate(String siteId) {
        long started = System.currentTimeMillis();
        LocalDateTime since = LocalDateTime.now(clock).minusDays(windowDays);
        Flux<String> sites = siteId != null && !siteId.isBlank()
                ? Flux.just(siteId)
                : patternRepository.findSiteIdsWithPatternsSince(since, minSeverity);

        return sites.collectList()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .flatMap(siteIds -> {
                    log.info("Recommendation generation started for {} sites with patterns since {}", siteIds.size(), since);
                    return Flux.fromIterable(siteIds)
                            .concatMap(this::generateForSite)
                            .collectList()
                            .map(outcomes -> JobReport.fold(JOB_NAME, outcomes, started));
                })
                .onErrorResume(e -> {
                    log.error("Recommendation generation could not load sites: {}", e.getMessage(), e);
                    return Mono.just(JobReport.<GenerationResult>failed(JOB_NAME, e.getMessage(),
                            System.currentTimeMillis() - started));
                })
                .doOnNext(report -> {
                    metrics.recordJobSiteFailures(report.errors().size());
                    metrics.recordJobDuration(JOB_NAME, Duration.ofMillis(report.executionTimeMs()));
                    if (!report.failed()) {
                        log.info("Recommendation generation finished: {} businesses, {} stored, {} failures in {}ms",
                                report.processed(),
                                report.results().stream().mapToInt(GenerationResult::stored).sum(),
                                report.errors().size(), report.executionTimeMs());
                    }
                });
    }

    private Mono<JobReport.Outcome<GenerationResult>> generateForSite(String siteId) {
        return businessRepository.findBySiteId(siteId)
                .timeout(resilience.getDatabaseTimeout())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.business_not_found")))
                .flatMap(business -> recommendationEngine.generate(GenerationRequest.of(business.getId(), siteId)))
                .map(JobReport.Outcome::success)
                .onErrorResume(e -> {
                    log.warn("Recommendation generation failed for site {}: {}", siteId, e.getMessage());
                    return Mono.just(JobReport.Outcome.<GenerationResult>failure(siteId, e));
                });
    }
}
