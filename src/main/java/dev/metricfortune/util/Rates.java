package dev.metricfortune.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and display helpers for the percentages and averages shown to store owners.
 */
public final class Rates {

    private Rates() {
    }

    /** Rounds half-up to two decimals. */
    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** Rounds half-up to one decimal. */
    public static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /** {@code 43.0 -> "43"}, {@code 43.5 -> "43.5"}. */
    public static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Percentage of {@code part} in {@code total}; 0 when total is 0. */
    public static double percent(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total * 100;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
