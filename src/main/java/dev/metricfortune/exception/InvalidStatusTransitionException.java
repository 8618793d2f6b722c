package dev.metricfortune.exception;

import dev.metricfortune.entity.RecommendationStatus;

public class InvalidStatusTransitionException extends RuntimeException {

    private final RecommendationStatus from;
    private final RecommendationStatus to;

    public InvalidStatusTransitionException(RecommendationStatus from, RecommendationStatus to) {
        super("Cannot move recommendation from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public RecommendationStatus getFrom() {
        return from;
    }

    public RecommendationStatus getTo() {
        return to;
    }
}
