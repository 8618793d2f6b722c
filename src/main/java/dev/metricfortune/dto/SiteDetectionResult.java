package dev.metricfortune.dto;

import java.util.List;

/**
 * Outcome of detecting and storing patterns for one site.
 *
 * @param detected patterns that met the thresholds
 * @param stored   rows actually inserted; duplicates of an earlier run are skipped
 * @param errors   per-pattern store failures
 */
public record SiteDetectionResult(String siteId, int detected, long stored, List<String> errors) {
}
