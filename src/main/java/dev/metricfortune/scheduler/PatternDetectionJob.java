package dev.metricfortune.scheduler;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.AnalysisWindow;
import dev.metricfortune.dto.SiteDetectionResult;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.service.analytics.PatternDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Daily pattern detection over every registered site. Sites are processed in batches, one site at a
 * time, so a run never holds more than one site's sessions in memory. A successful run triggers
 * recommendation generation.
 */
@Component
@Slf4j
public class PatternDetectionJob {

    static final String JOB_NAME = "pattern-detection";
    static final String LOCK_KEY = "scheduler:pattern-detection:lock";
    private static final Duration LOCK_TTL = Duration.ofHours(2);

    private final BusinessRepository businessRepository;
    private final PatternDetector patternDetector;
    private final RecommendationGenerationJob recommendationJob;
    private final JobLock jobLock;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final int windowDays;
    private final int batchSize;

    public PatternDetectionJob(BusinessRepository businessRepository,
                               PatternDetector patternDetector,
                               RecommendationGenerationJob recommendationJob,
                               JobLock jobLock,
                               ResilienceConfig resilience,
                               PipelineMetrics metrics,
                               Clock clock,
                               @Value("${insights.detection.window-days:7}") int windowDays,
                               @Value("${insights.detection.site-batch-size:10}") int batchSize) {
        this.businessRepository = businessRepository;
        this.patternDetector = patternDetector;
        this.recommendationJob = recommendationJob;
        this.jobLock = jobLock;
        this.resilience = resilience;
        this.metrics = metrics;
        this.clock = clock;
        this.windowDays = windowDays;
        this.batchSize = batchSize;
    }

    @Scheduled(cron = "${insights.detection.cron:0 0 2 * * *}", zone = "UTC")
    public void scheduledRun() {
        trigger();
    }

    /** Starts a run in the background. */
    public void trigger() {
        run().subscribe(
                null,
                error -> log.error("Pattern detection job failed: {}", error.getMessage(), error),
                () -> log.debug("Pattern detection job finished")
        );
    }

    /**
     * Runs detection for all sites. Completes empty when another instance is already running.
     */
    public Mono<JobReport<SiteDetectionResult>> run() {
        return jobLock.withLock(LOCK_KEY, LOCK_TTL, this::detectAll)
                .doOnNext(report -> {
                    if (!report.failed()) {
                        recommendationJob.trigger(null);
                    }
                });
    }

    Mono<JobReport<SiteDetectionResult>> detectAll() {
        long started = System.currentTimeMillis();
        AnalysisWindow window = AnalysisWindow.trailingDays(windowDays, clock);
        log.info("Pattern detection started for window {} to {}", window.start(), window.end());

        return businessRepository.findAllSiteIds()
                .filter(siteId -> siteId != null && !siteId.isBlank())
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .flatMap(siteIds -> Flux.fromIterable(siteIds)
                        .buffer(batchSize)
                        .index()
                        .concatMap(batch -> {
                            log.info("Processing site batch {}: {} sites", batch.getT1() + 1, batch.getT2().size());
                            return Flux.fromIterable(batch.getT2()).concatMap(siteId -> detectSite(siteId, window));
                        })
                        .collectList()
                        .map(outcomes -> JobReport.fold(JOB_NAME, outcomes, started)))
                .onErrorResume(e -> {
                    log.error("Pattern detection could not load sites: {}", e.getMessage(), e);
                    return Mono.just(JobReport.<SiteDetectionResult>failed(JOB_NAME, e.getMessage(), System.currentTimeMillis() - started));
                })
                .doOnNext(report -> {
                    metrics.recordJobSiteFailures(report.errors().size());
                    metrics.recordJobDuration(JOB_NAME, Duration.ofMillis(report.executionTimeMs()));
                    if (!report.failed()) {
                        log.info("Pattern detection finished: {} sites, {} patterns stored, {} site failures in {}ms",
                                report.processed(),
                                report.results().stream().mapToLong(SiteDetectionResult::stored).sum(),
                                report.errors().size(), report.executionTimeMs());
                    }
                });
    }

    private Mono<JobReport.Outcome<SiteDetectionResult>> detectSite(String siteId, AnalysisWindow window) {
        return patternDetector.detectAndStore(siteId, window)
                .map(JobReport.Outcome::success)
                .onErrorResume(e -> {
                    log.warn("Pattern detection failed for site {}: {}", siteId, e.getMessage());
                    return Mono.just(JobReport.Outcome.<SiteDetectionResult>failure(siteId, e));
                });
    }
}
