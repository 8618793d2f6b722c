package dev.metricfortune.scheduler;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.repository.TrackingEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Deletes raw tracking events older than {@code tracking.retention-days}.
 */
@Component
@Slf4j
public class TrackingRetentionJob {

    static final String LOCK_KEY = "scheduler:tracking-retention:lock";
    private static final Duration LOCK_TTL = Duration.ofMinutes(30);

    private final TrackingEventRepository trackingEventRepository;
    private final JobLock jobLock;
    private final ResilienceConfig resilience;
    private final Clock clock;
    private final int retentionDays;

    public TrackingRetentionJob(TrackingEventRepository trackingEventRepository,
                                JobLock jobLock,
                                ResilienceConfig resilience,
                                Clock clock,
                                @Value("${tracking.retention-days:90}") int retentionDays) {
        this.trackingEventRepository = trackingEventRepository;
        this.jobLock = jobLock;
        this.resilience = resilience;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${tracking.retention-cron:0 30 3 * * *}", zone = "UTC")
    public void purgeExpiredEvents() {
        run().subscribe(
                null,
                error -> log.error("Tracking retention purge failed: {}", error.getMessage()),
                () -> log.debug("Tracking retention purge completed")
        );
    }

    public Mono<Long> run() {
        return jobLock.withLock(LOCK_KEY, LOCK_TTL, () -> {
            LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
            return trackingEventRepository.deleteOlderThan(cutoff)
                    .timeout(resilience.getDatabaseTimeout())
                    .doOnNext(deleted -> log.info("Deleted {} tracking events older than {}", deleted, cutoff));
        });
    }
}
