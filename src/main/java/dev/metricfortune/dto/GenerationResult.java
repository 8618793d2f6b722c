package dev.metricfortune.dto;

import java.util.List;

/**
 * Outcome of one recommendation generation run for a business.
 *
 * @param generated candidates left after dedup and truncation
 * @param stored    recommendations written
 * @param skipped   candidates dropped because an equivalent NEW recommendation already exists
 */
public record GenerationResult(Long businessId, String siteId, int patternsProcessed, int generated, int stored,
                               int skipped, List<String> errors, long executionTimeMs) {
}
