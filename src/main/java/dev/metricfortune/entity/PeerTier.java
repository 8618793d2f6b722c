package dev.metricfortune.entity;

/**
 * Matching strictness actually used to assemble a peer group, strictest first.
 */
public enum PeerTier {
    STRICT,
    RELAXED,
    BROAD,
    FALLBACK;

    public boolean matches(String tier) {
        return this.name().equals(tier);
    }
}
