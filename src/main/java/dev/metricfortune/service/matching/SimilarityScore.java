package dev.metricfortune.service.matching;

public record SimilarityScore(Long businessId, double score, boolean industryMatch, boolean revenueMatch,
                              double productTypesSimilarity, boolean platformMatch) {
}
