package dev.metricfortune.service.recommendation;

/**
 * Peer evidence for one recommendation.
 *
 * @param similarBusinessCount    peer group members other than the business itself
 * @param implementationCount     peer recommendations with a similar title marked implemented
 * @param successRate             share of implementations that helped, 0..1
 * @param averageImprovementPercent mean reported improvement
 */
public record PeerSuccessStats(int similarBusinessCount, int implementationCount, double successRate,
                               double averageImprovementPercent) {

    /**
     * One-line narrative, or null when no peer implemented it. Never an empty string.
     */
    public String narrative() {
        if (implementationCount == 0) {
            return null;
        }
        return implementationCount + " similar " + (implementationCount == 1 ? "store" : "stores")
                + " implemented this and saw " + Math.round(averageImprovementPercent) + "% average improvement";
    }
}
