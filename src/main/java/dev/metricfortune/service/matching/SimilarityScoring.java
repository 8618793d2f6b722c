package dev.metricfortune.service.matching;

import dev.metricfortune.entity.Business;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business-to-business similarity. Industry is a hard gate; otherwise revenue within one band
 * weighs 0.3, product-type Jaccard 0.4 and same platform 0.3.
 */
public final class SimilarityScoring {

    static final double REVENUE_WEIGHT = 0.3;
    static final double PRODUCT_WEIGHT = 0.4;
    static final double PLATFORM_WEIGHT = 0.3;

    private SimilarityScoring() {
    }

    /**
     * Case-insensitive Jaccard coefficient. Two empty sets are identical (1.0); one empty set shares nothing (0.0).
     */
    public static double jaccard(String[] a, String[] b) {
        Set<String> first = normalize(a);
        Set<String> second = normalize(b);
        if (first.isEmpty() && second.isEmpty()) return 1.0;
        if (first.isEmpty() || second.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        return (double) intersection.size() / union.size();
    }

    public static SimilarityScore score(Business business, Business candidate) {
        boolean industryMatch = Objects.equals(business.getIndustry(), candidate.getIndustry());
        if (!industryMatch) {
            return new SimilarityScore(candidate.getId(), 0, false, false, 0, false);
        }
        boolean revenueMatch = RevenueRanges.withinTiers(business.getRevenueRange(), candidate.getRevenueRange(), 1);
        double products = jaccard(business.getProductTypes(), candidate.getProductTypes());
        boolean platformMatch = Objects.equals(business.getPlatform(), candidate.getPlatform());

        double score = (revenueMatch ? REVENUE_WEIGHT : 0)
                + products * PRODUCT_WEIGHT
                + (platformMatch ? PLATFORM_WEIGHT : 0);
        return new SimilarityScore(candidate.getId(), score, true, revenueMatch, products, platformMatch);
    }

    private static Set<String> normalize(String[] values) {
        if (values == null) {
            return Set.of();
        }
        return Arrays.stream(values)
                .filter(Objects::nonNull)
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
