package dev.metricfortune.dto;

import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one fixed-window quota check.
 *
 * @param allowed   whether the request fits in the current window
 * @param limit     requests allowed per window
 * @param remaining requests left in the window after this one
 * @param resetAt   when the current window ends
 */
public record RateLimitDecision(boolean allowed, int limit, long remaining, Instant resetAt) {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    public static RateLimitDecision of(long count, int limit, Instant resetAt) {
        return new RateLimitDecision(count <= limit, limit, Math.max(0, limit - count), resetAt);
    }

    /** Whole seconds until the window resets, at least 1. */
    public long retryAfterSeconds() {
        long seconds = Duration.between(Instant.now(), resetAt).toSeconds();
        return Math.max(1, seconds);
    }

    public void writeTo(HttpHeaders headers) {
        headers.set(LIMIT_HEADER, String.valueOf(limit));
        headers.set(REMAINING_HEADER, String.valueOf(remaining));
        headers.set(RESET_HEADER, String.valueOf(resetAt.toEpochMilli()));
    }
}
