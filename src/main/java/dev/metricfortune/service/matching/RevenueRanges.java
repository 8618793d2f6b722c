package dev.metricfortune.service.matching;

import java.util.List;

/**
 * Ordered annual revenue bands. Distance between two bands is the difference of their positions.
 */
public final class RevenueRanges {

    public static final List<String> TIERS = List.of(
            "$0-100k", "$100k-500k", "$500k-1M", "$1M-5M", "$5M-10M", "$10M-50M", "$50M+");

    private RevenueRanges() {
    }

    /** Position of the band, -1 when unknown. */
    public static int indexOf(String revenueRange) {
        return revenueRange == null ? -1 : TIERS.indexOf(revenueRange);
    }

    /** False when either band is unknown. */
    public static boolean withinTiers(String a, String b, int maxDistance) {
        int first = indexOf(a);
        int second = indexOf(b);
        if (first < 0 || second < 0) {
            return false;
        }
        return Math.abs(first - second) <= maxDistance;
    }
}
