package dev.metricfortune.service.recommendation;

import dev.metricfortune.entity.InsightLevel;
import dev.metricfortune.entity.Recommendation;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Display orderings for stored recommendations. Independent of the generation-time impact score.
 */
public final class RecommendationRanking {

    private static final Comparator<Recommendation> NEWEST_FIRST = Comparator.comparing(
            Recommendation::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    /** impact weight x confidence weight (HIGH=3, MEDIUM=2, LOW=1) descending, newest first on ties. */
    public static final Comparator<Recommendation> PRIORITY = Comparator
            .comparingInt(RecommendationRanking::priorityScore).reversed()
            .thenComparing(NEWEST_FIRST);

    public static final Comparator<Recommendation> CREATED_AT_DESC = NEWEST_FIRST;

    private RecommendationRanking() {
    }

    public static int priorityScore(Recommendation recommendation) {
        return InsightLevel.weightOf(recommendation.getImpactLevel())
                * InsightLevel.weightOf(recommendation.getConfidenceLevel());
    }

    /**
     * @param sortBy    {@code priority} (default) or {@code createdAt}
     * @param sortOrder {@code desc} (default) or {@code asc}
     */
    public static Comparator<Recommendation> forSort(String sortBy, String sortOrder) {
        Comparator<Recommendation> comparator = "createdAt".equals(sortBy) ? CREATED_AT_DESC : PRIORITY;
        return "asc".equalsIgnoreCase(sortOrder) ? comparator.reversed() : comparator;
    }
}
