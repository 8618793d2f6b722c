package dev.metricfortune.dto;

import lombok.Builder;

/**
 * Inputs of a generation run. Unset numeric options fall back to the configured defaults.
 */
@Builder(toBuilder = true)
public record GenerationRequest(Long businessId, String siteId, Integer windowDays, Double minSeverity,
                                Integer maxRecommendations, Boolean includePeerData) {

    public static GenerationRequest of(Long businessId, String siteId) {
        return GenerationRequest.builder().businessId(businessId).siteId(siteId).build();
    }
}
