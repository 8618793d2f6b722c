package dev.metricfortune.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch job run. Per-site failures are collected in {@code errors} and do not fail
 * the run; {@code failed} is set only when the job could not start processing at all.
 */
public record JobReport<T>(String job, List<T> results, List<SiteError> errors, boolean failed,
                           String failureMessage, long executionTimeMs) {

    public record SiteError(String siteId, String message) {}

    /** Result of processing one site: exactly one of the two is set. */
    public record Outcome<T>(T result, SiteError error) {

        public static <T> Outcome<T> success(T result) {
            return new Outcome<>(result, null);
        }

        public static <T> Outcome<T> failure(String siteId, Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Outcome<>(null, new SiteError(siteId, message));
        }
    }

    public static <T> JobReport<T> fold(String job, List<Outcome<T>> outcomes, long started) {
        List<T> results = new ArrayList<>();
        List<SiteError> errors = new ArrayList<>();
        for (Outcome<T> outcome : outcomes) {
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else {
                results.add(outcome.result());
            }
        }
        return completed(job, results, errors, System.currentTimeMillis() - started);
    }

    public static <T> JobReport<T> completed(String job, List<T> results, List<SiteError> errors, long executionTimeMs) {
        return new JobReport<>(job, List.copyOf(results), List.copyOf(errors), false, null, executionTimeMs);
    }

    public static <T> JobReport<T> failed(String job, String message, long executionTimeMs) {
        return new JobReport<>(job, List.of(), List.of(), true, message, executionTimeMs);
    }

    public int processed() {
        return results.size() + errors.size();
    }
}
