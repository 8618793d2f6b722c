package dev.metricfortune.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    // cached counter references, avoids a registry lookup per event
    private Counter eventsAcceptedCounter;
    private Counter eventsPersistedCounter;
    private Counter flushFailureCounter;
    private Counter rateLimitedCounter;
    private Counter patternsStoredCounter;
    private Counter recommendationsCreatedCounter;
    private Counter jobSiteFailureCounter;

    @PostConstruct
    public void init() {
        eventsAcceptedCounter = Counter.builder("tracking.events.accepted")
                .description("Events accepted by the tracking endpoint")
                .register(meterRegistry);
        eventsPersistedCounter = Counter.builder("tracking.events.persisted")
                .description("Events written to the store")
                .register(meterRegistry);
        flushFailureCounter = Counter.builder("tracking.buffer.flush.failures")
                .description("Buffer flushes that failed and were re-queued")
                .register(meterRegistry);
        rateLimitedCounter = Counter.builder("tracking.requests.rate_limited")
                .description("Tracking batches rejected by the per-site quota")
                .register(meterRegistry);
        patternsStoredCounter = Counter.builder("insights.patterns.stored")
                .description("Patterns persisted by detection runs")
                .register(meterRegistry);
        recommendationsCreatedCounter = Counter.builder("insights.recommendations.created")
                .description("Recommendations created by generation runs")
                .register(meterRegistry);
        jobSiteFailureCounter = Counter.builder("insights.jobs.site_failures")
                .description("Per-site failures recorded by batch jobs")
                .register(meterRegistry);
        log.debug("Pipeline metrics registered");
    }

    public void bindBufferSize(Supplier<Number> size) {
        Gauge.builder("tracking.buffer.size", size)
                .description("Events waiting in the in-memory buffer")
                .register(meterRegistry);
    }

    public void recordAccepted(int count) {
        eventsAcceptedCounter.increment(count);
    }

    public void recordPersisted(long count) {
        eventsPersistedCounter.increment(count);
    }

    public void recordFlushFailure() {
        flushFailureCounter.increment();
    }

    public void recordRateLimited() {
        rateLimitedCounter.increment();
    }

    public void recordPatternsStored(long count) {
        patternsStoredCounter.increment(count);
    }

    public void recordRecommendationsCreated(long count) {
        recommendationsCreatedCounter.increment(count);
    }

    public void recordJobSiteFailures(int count) {
        jobSiteFailureCounter.increment(count);
    }

    public void recordJobDuration(String job, Duration duration) {
        Timer.builder("insights.jobs.duration")
                .tag("job", job)
                .description("Wall time of batch job runs")
                .register(meterRegistry)
                .record(duration);
    }
}
