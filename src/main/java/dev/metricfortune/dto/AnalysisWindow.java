package dev.metricfortune.dto;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Closed date range analyzed by a detection run.
 */
public record AnalysisWindow(LocalDateTime start, LocalDateTime end) {

    public AnalysisWindow {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid analysis window: " + start + " to " + end);
        }
    }

    /**
     * The {@code days} full days before today (UTC midnight to UTC midnight), so repeated runs on
     * the same day share a window start.
     */
    public static AnalysisWindow trailingDays(int days, Clock clock) {
        LocalDateTime end = LocalDate.now(clock).atStartOfDay();
        return new AnalysisWindow(end.minusDays(days), end);
    }
}
