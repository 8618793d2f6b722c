package dev.metricfortune.entity;

/**
 * Discrete impact / confidence level attached to a recommendation.
 * Both are derived from the source pattern and never edited by hand.
 */
public enum InsightLevel {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    static final double IMPACT_HIGH = 0.71;
    static final double IMPACT_MEDIUM = 0.41;
    static final double CONFIDENCE_HIGH = 0.86;
    static final double CONFIDENCE_MEDIUM = 0.66;

    private final int weight;

    InsightLevel(int weight) {
        this.weight = weight;
    }

    /** 3 for HIGH, 2 for MEDIUM, 1 for LOW. */
    public int weight() {
        return weight;
    }

    public boolean matches(String level) {
        return this.name().equals(level);
    }

    public static InsightLevel forSeverity(double severity) {
        if (severity >= IMPACT_HIGH) return HIGH;
        if (severity >= IMPACT_MEDIUM) return MEDIUM;
        return LOW;
    }

    public static InsightLevel forConfidence(double confidenceScore) {
        if (confidenceScore >= CONFIDENCE_HIGH) return HIGH;
        if (confidenceScore >= CONFIDENCE_MEDIUM) return MEDIUM;
        return LOW;
    }

    /** Unknown or null values rank as LOW. */
    public static int weightOf(String level) {
        if (level == null) return LOW.weight;
        for (InsightLevel value : values()) {
            if (value.matches(level)) return value.weight;
        }
        return LOW.weight;
    }
}
