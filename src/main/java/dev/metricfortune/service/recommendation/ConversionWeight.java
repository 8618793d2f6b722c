package dev.metricfortune.service.recommendation;

/**
 * How directly a fix moves conversion. Abandonment is closest to revenue, engagement furthest.
 */
public enum ConversionWeight {
    HIGH(3.0),
    MEDIUM(2.0),
    LOW_MEDIUM(1.5);

    private final double weight;

    ConversionWeight(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    /** {@code severity x weight}, the generation-time ranking key. */
    public double impactScore(double severity) {
        return severity * weight;
    }
}
