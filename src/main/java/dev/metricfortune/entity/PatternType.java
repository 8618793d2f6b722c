package dev.metricfortune.entity;

/**
 * Pattern families surfaced by the detector.
 * Entity fields keep the name as a String; use {@link #matches(String)} for comparisons.
 */
public enum PatternType {
    ABANDONMENT,
    HESITATION,
    LOW_ENGAGEMENT;

    public boolean matches(String type) {
        return this.name().equals(type);
    }
}
