package dev.metricfortune.service.matching;

import dev.metricfortune.entity.Session;
import dev.metricfortune.service.analytics.JourneyFunnelCalculator;
import dev.metricfortune.util.Rates;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Site metrics computed from sessions, and how one site ranks against its peers.
 * Average order value is not computed: sessions carry no order amounts.
 */
@Component
public class PeerMetricsCalculator {

    public record SiteMetrics(double conversionRate, double cartAbandonmentRate, double bounceRate, int sessionCount) {

        public static final SiteMetrics EMPTY = new SiteMetrics(0, 0, 0, 0);
    }

    public enum Metric {
        CONVERSION_RATE("conversion rate", true, SiteMetrics::conversionRate),
        CART_ABANDONMENT_RATE("cart abandonment rate", false, SiteMetrics::cartAbandonmentRate),
        BOUNCE_RATE("bounce rate", false, SiteMetrics::bounceRate);

        private final String label;
        private final boolean higherIsBetter;
        private final ToDoubleFunction<SiteMetrics> extractor;

        Metric(String label, boolean higherIsBetter, ToDoubleFunction<SiteMetrics> extractor) {
            this.label = label;
            this.higherIsBetter = higherIsBetter;
            this.extractor = extractor;
        }

        public String label() {
            return label;
        }

        public boolean higherIsBetter() {
            return higherIsBetter;
        }

        public double valueOf(SiteMetrics metrics) {
            return extractor.applyAsDouble(metrics);
        }
    }

    public record PercentileRank(String bucket, int value) {}

    public SiteMetrics metricsFor(List<Session> sessions) {
        int total = sessions.size();
        if (total == 0) {
            return SiteMetrics.EMPTY;
        }
        long converted = sessions.stream().filter(Session::isConverted).count();
        long bounced = sessions.stream().filter(Session::isBounced).count();
        long cart = sessions.stream().filter(s -> visited(s, JourneyFunnelCalculator::isCartPage)).count();
        long checkout = sessions.stream().filter(s -> visited(s, JourneyFunnelCalculator::isCheckoutPage)).count();

        return new SiteMetrics(
                Rates.percent(converted, total),
                cart > 0 ? (double) (cart - checkout) / cart * 100 : 0,
                Rates.percent(bounced, total),
                total);
    }

    /** Mean of each metric across peers. */
    public SiteMetrics average(List<SiteMetrics> peers) {
        if (peers.isEmpty()) {
            return SiteMetrics.EMPTY;
        }
        return new SiteMetrics(
                peers.stream().mapToDouble(SiteMetrics::conversionRate).average().orElse(0),
                peers.stream().mapToDouble(SiteMetrics::cartAbandonmentRate).average().orElse(0),
                peers.stream().mapToDouble(SiteMetrics::bounceRate).average().orElse(0),
                peers.stream().mapToInt(SiteMetrics::sessionCount).sum());
    }

    /**
     * Share of peers the value beats, bucketed as {@code top-25} (&ge; 75), {@code median} (&ge; 25)
     * or {@code bottom-25}. No peers ranks as the median.
     */
    public PercentileRank percentile(double value, List<Double> peerValues, boolean higherIsBetter) {
        if (peerValues.isEmpty()) {
            return new PercentileRank("median", 50);
        }
        long beaten = peerValues.stream()
                .filter(peer -> higherIsBetter ? peer < value : peer > value)
                .count();
        int percentile = (int) Math.round((double) beaten / peerValues.size() * 100);
        String bucket = percentile >= 75 ? "top-25" : percentile >= 25 ? "median" : "bottom-25";
        return new PercentileRank(bucket, percentile);
    }

    public String performance(double value, double peerAverage) {
        if (value > peerAverage) return "above";
        if (value < peerAverage) return "below";
        return "at";
    }

    /** e.g. {@code Your 3.2% conversion rate is in the top 20% of peers}. */
    public String explanation(Metric metric, double value, double peerAverage, int percentile) {
        boolean better = metric.higherIsBetter() ? value >= peerAverage : value <= peerAverage;
        String formatted = String.format(Locale.ROOT, "%.1f%%", value);
        return better
                ? "Your " + formatted + " " + metric.label() + " is in the top " + (100 - percentile) + "% of peers"
                : "Your " + formatted + " " + metric.label() + " is in the bottom " + percentile + "% of peers";
    }

    private static boolean visited(Session session, Predicate<String> page) {
        return session.getJourneyPath() != null && Arrays.stream(session.getJourneyPath())
                .map(url -> url.toLowerCase(Locale.ROOT))
                .anyMatch(page);
    }
}
