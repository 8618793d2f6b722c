package dev.metricfortune.exception;

import dev.metricfortune.dto.RateLimitDecision;

/**
 * Per-site tracking quota exhausted. Carries the decision so the handler can emit
 * {@code X-RateLimit-*} and {@code Retry-After} headers.
 */
public class RateLimitExceededException extends RuntimeException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("error.rate_limit_exceeded");
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
