package dev.metricfortune.service.analytics;

import dev.metricfortune.util.Rates;

/**
 * Scoring shared by all pattern families.
 */
public final class PatternScoring {

    public static final int MIN_SESSIONS = 100;
    public static final double ABANDONMENT_RATE = 30.0;
    public static final double HESITATION_RATE = 20.0;
    public static final double LOW_ENGAGEMENT_RATIO = 0.7;
    public static final int MIN_PAGEVIEWS_PER_URL = 50;

    static final int CONFIDENCE_VERY_HIGH_MIN = 500;
    static final int CONFIDENCE_HIGH_MIN = 200;
    static final int CONFIDENCE_MEDIUM_MIN = MIN_SESSIONS;

    private PatternScoring() {
    }

    /**
     * {@code rate * 0.7 + (affected / total) * 0.3}, clamped to [0, 1].
     *
     * @param rate     pattern rate as a fraction, not a percentage
     * @param affected sessions (or pageviews) the pattern covers
     * @param total    sessions analyzed for the site
     */
    public static double severity(double rate, long affected, long total) {
        double volume = total == 0 ? 0.0 : (double) affected / total;
        return Rates.clamp01(rate * 0.7 + volume * 0.3);
    }

    /**
     * Step function of the sample size: 0 below 100, then 0.6, 0.8 and 1.0 at 100, 200 and 500.
     */
    public static double confidence(long sampleSize) {
        if (sampleSize >= CONFIDENCE_VERY_HIGH_MIN) return 1.0;
        if (sampleSize >= CONFIDENCE_HIGH_MIN) return 0.8;
        if (sampleSize >= CONFIDENCE_MEDIUM_MIN) return 0.6;
        return 0.0;
    }
}
