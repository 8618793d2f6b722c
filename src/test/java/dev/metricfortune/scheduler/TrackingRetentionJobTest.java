package dev.metricfortune.scheduler;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.repository.TrackingEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TrackingRetentionJob")
class TrackingRetentionJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T03:30:00Z"), ZoneOffset.UTC);

    @Mock private TrackingEventRepository trackingEventRepository;
    @Mock private JobLock jobLock;

    private TrackingRetentionJob job;

    @BeforeEach
    void setUp() {
        job = new TrackingRetentionJob(trackingEventRepository, jobLock, new ResilienceConfig(10, 3, 100, 1000, 5),
                CLOCK, 90);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should delete events older than the retention period")
    void shouldDeleteExpiredEvents() {
        when(jobLock.withLock(eq(TrackingRetentionJob.LOCK_KEY), any(Duration.class), any()))
                .thenAnswer(inv -> ((Supplier<Mono<?>>) inv.getArgument(2)).get());
        when(trackingEventRepository.deleteOlderThan(LocalDateTime.of(2025, 3, 3, 3, 30))).thenReturn(Mono.just(42L));

        StepVerifier.create(job.run())
                .expectNext(42L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should not purge when another instance holds the lock")
    void shouldSkipWhenLocked() throws InterruptedException {
        when(jobLock.withLock(eq(TrackingRetentionJob.LOCK_KEY), any(Duration.class), any())).thenReturn(Mono.empty());

        job.purgeExpiredEvents();

        // Allow async subscribe to complete
        Thread.sleep(200);

        verifyNoInteractions(trackingEventRepository);
    }
}
