package dev.metricfortune.config;

import dev.metricfortune.exception.TransientStoreException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Timeouts and retry policy for store calls.
 *
 * <pre>
 * return patternRepository.findForSite(siteId, since, minSeverity)
 *         .timeout(resilience.getDatabaseTimeout())
 *         .retryWhen(resilience.databaseRetry());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration redisTimeout;
    private final int databaseRetryMaxAttempts;
    private final Duration databaseRetryMinBackoff;
    private final Duration databaseRetryMaxBackoff;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.database.retry-max-attempts:3}") int databaseRetryMaxAttempts,
            @Value("${resilience.database.retry-min-backoff-ms:100}") int databaseRetryMinBackoffMs,
            @Value("${resilience.database.retry-max-backoff-ms:1000}") int databaseRetryMaxBackoffMs,
            @Value("${resilience.redis.timeout-seconds:5}") int redisTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.redisTimeout = Duration.ofSeconds(redisTimeoutSeconds);
        this.databaseRetryMaxAttempts = databaseRetryMaxAttempts;
        this.databaseRetryMinBackoff = Duration.ofMillis(databaseRetryMinBackoffMs);
        this.databaseRetryMaxBackoff = Duration.ofMillis(databaseRetryMaxBackoffMs);
        log.info("Resilience configuration initialized: db timeout {}s, {} retries", databaseTimeoutSeconds,
                databaseRetryMaxAttempts);
    }

    /**
     * Exponential backoff with jitter, transient failures only. Exhausted retries surface as
     * {@link TransientStoreException}.
     */
    public Retry databaseRetry() {
        return Retry.backoff(databaseRetryMaxAttempts, databaseRetryMinBackoff)
                .maxBackoff(databaseRetryMaxBackoff)
                .jitter(0.5)
                .filter(ResilienceConfig::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying store operation, attempt {}/{}: {}",
                        signal.totalRetries() + 1, databaseRetryMaxAttempts, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) ->
                        new TransientStoreException("Store operation failed after retries", signal.failure()));
    }

    /**
     * Connection drops, timeouts and deadlocks are worth retrying; constraint and
     * validation failures are not.
     */
    public static boolean isTransient(Throwable throwable) {
        if (throwable instanceof TransientDataAccessException || throwable instanceof TimeoutException) {
            return true;
        }
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("connection")
                || lower.contains("timeout")
                || lower.contains("temporarily unavailable")
                || lower.contains("too many connections")
                || lower.contains("deadlock");
    }
}
