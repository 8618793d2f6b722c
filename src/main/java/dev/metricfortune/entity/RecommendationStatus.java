package dev.metricfortune.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Recommendation lifecycle. NEW may move to any other state, PLANNED only to a terminal one,
 * IMPLEMENTED and DISMISSED are terminal.
 */
public enum RecommendationStatus {
    NEW,
    PLANNED,
    IMPLEMENTED,
    DISMISSED;

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    public boolean canTransitionTo(RecommendationStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<RecommendationStatus> allowedTargets() {
        return switch (this) {
            case NEW -> EnumSet.of(PLANNED, IMPLEMENTED, DISMISSED);
            case PLANNED -> EnumSet.of(IMPLEMENTED, DISMISSED);
            case IMPLEMENTED, DISMISSED -> EnumSet.noneOf(RecommendationStatus.class);
        };
    }

    public static RecommendationStatus from(String status) {
        return RecommendationStatus.valueOf(status);
    }
}
