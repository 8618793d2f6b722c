package dev.metricfortune.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query options for listing a business's recommendations. Null fields do not filter.
 * {@code sortBy} is {@code priority} (impact x confidence) or {@code createdAt}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationFilter {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private String status;
    private String impactLevel;
    private String confidenceLevel;

    @Builder.Default
    private String sortBy = "priority";

    @Builder.Default
    private String sortOrder = "desc";

    @Builder.Default
    private int limit = DEFAULT_LIMIT;
}
