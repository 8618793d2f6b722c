package dev.metricfortune.service.analytics;

import dev.metricfortune.dto.AnalysisWindow;
import dev.metricfortune.dto.FunnelReport;
import dev.metricfortune.entity.Session;
import dev.metricfortune.util.Rates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the five-stage journey funnel from session journey paths.
 *
 * <p>A session counts toward its deepest stage and every stage before it, so stage counts never
 * increase down the funnel. Purchase is reached by the converted flag or a confirmation page.</p>
 */
@Component
public class JourneyFunnelCalculator {

    public static final List<String> STAGES = List.of("Entry", "Product View", "Cart", "Checkout", "Purchase");

    private static final int ENTRY = 0;
    private static final int PRODUCT = 1;
    private static final int CART = 2;
    private static final int CHECKOUT = 3;
    private static final int PURCHASE = 4;

    private static final int TOP_PAGES = 5;
    private static final int MAX_POSITIONS = 20;

    public FunnelReport calculate(List<Session> sessions, JourneyType journeyType, AnalysisWindow window) {
        List<Session> filtered = journeyType == JourneyType.ALL
                ? sessions
                : sessions.stream().filter(s -> journeyTypeOf(s) == journeyType).toList();

        int total = filtered.size();
        int[] reached = new int[STAGES.size()];
        List<Map<String, Integer>> stagePages = new ArrayList<>();
        List<List<Double>> stageDurations = new ArrayList<>();
        for (int i = 0; i < STAGES.size(); i++) {
            stagePages.add(new LinkedHashMap<>());
            stageDurations.add(new ArrayList<>());
        }

        for (Session session : filtered) {
            String[] path = pathOf(session);
            int deepest = deepestStage(session);
            for (int stage = ENTRY; stage <= deepest; stage++) {
                reached[stage]++;
                for (String page : pagesForStage(path, stage)) {
                    stagePages.get(stage).merge(page, 1, Integer::sum);
                }
                if (session.getDuration() != null && session.getDuration() > 0) {
                    stageDurations.get(stage).add((double) session.getDuration() / (deepest + 1));
                }
            }
        }

        List<FunnelReport.Stage> stages = new ArrayList<>();
        for (int i = 0; i < STAGES.size(); i++) {
            int count = reached[i];
            Double dropOff = null;
            if (i > 0) {
                int previous = reached[i - 1];
                dropOff = Rates.round1(Rates.percent(previous - count, previous));
            }
            Double conversion = null;
            if (i < STAGES.size() - 1) {
                conversion = Rates.round1(Rates.percent(reached[i + 1], count));
            }
            List<Double> durations = stageDurations.get(i);
            Long avgTime = durations.isEmpty() ? null
                    : Math.round(durations.stream().mapToDouble(Double::doubleValue).average().orElse(0));

            stages.add(FunnelReport.Stage.builder()
                    .name(STAGES.get(i))
                    .count(count)
                    .percentage(Rates.round1(Rates.percent(count, total)))
                    .dropOffRate(dropOff)
                    .conversionRate(conversion)
                    .avgTimeSpent(avgTime)
                    .topPages(topPages(stagePages.get(i)))
                    .build());
        }

        FunnelReport report = FunnelReport.builder()
                .stages(stages)
                .totalSessions(total)
                .overallConversion(Rates.round1(Rates.percent(reached[PURCHASE], total)))
                .journeyType(journeyType.wireName())
                .windowStart(window != null ? window.start() : null)
                .windowEnd(window != null ? window.end() : null)
                .positionReach(positionReach(filtered))
                .journeyTypes(journeyTypeStats(sessions))
                .build();
        report.setInsight(insight(report));
        return report;
    }

    /**
     * Plain-language summary: the biggest drop-off and the best stage-to-stage conversion.
     */
    public FunnelReport.Insight insight(FunnelReport report) {
        if (report.getTotalSessions() == 0) {
            return FunnelReport.Insight.builder()
                    .primary("No data yet. Start collecting sessions to see journey insights.")
                    .build();
        }
        double maxDropOff = 0;
        String dropOffStage = null;
        double maxConversion = 0;
        String bestStage = null;
        for (FunnelReport.Stage stage : report.getStages()) {
            if (stage.getDropOffRate() != null && stage.getDropOffRate() > maxDropOff) {
                maxDropOff = stage.getDropOffRate();
                dropOffStage = stage.getName();
            }
            if (stage.getConversionRate() != null && stage.getConversionRate() > maxConversion) {
                maxConversion = stage.getConversionRate();
                bestStage = stage.getName();
            }
        }

        return FunnelReport.Insight.builder()
                .primary(dropOffStage != null
                        ? "Your biggest opportunity: " + oneDecimal(maxDropOff) + "% abandon at " + dropOffStage
                        : "Great! No significant drop-offs detected in your funnel.")
                .secondary(bestStage != null
                        ? "Strong performance: " + oneDecimal(maxConversion) + "% convert from " + bestStage + " to next stage"
                        : null)
                .biggestDropOffStage(dropOffStage)
                .biggestDropOffRate(dropOffStage != null ? maxDropOff : null)
                .bestPerformingStage(bestStage)
                .bestConversionRate(bestStage != null ? maxConversion : null)
                .build();
    }

    public List<FunnelReport.JourneyTypeStats> journeyTypeStats(List<Session> sessions) {
        Map<JourneyType, Integer> counts = new EnumMap<>(JourneyType.class);
        for (JourneyType type : JourneyType.values()) {
            counts.put(type, 0);
        }
        counts.put(JourneyType.ALL, sessions.size());
        for (Session session : sessions) {
            counts.merge(journeyTypeOf(session), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .map(entry -> FunnelReport.JourneyTypeStats.builder()
                        .type(entry.getKey().wireName())
                        .label(entry.getKey().label())
                        .count(entry.getValue())
                        .percentage(Rates.round1(Rates.percent(entry.getValue(), sessions.size())))
                        .build())
                .toList();
    }

    public JourneyType journeyTypeOf(Session session) {
        String entry = session.getEntryPage();
        if (entry == null) {
            String[] path = pathOf(session);
            entry = path.length > 0 ? path[0] : "";
        }
        entry = entry.toLowerCase(Locale.ROOT);
        if (entry.isEmpty() || entry.equals("/") || entry.contains("/home")) {
            return JourneyType.HOMEPAGE;
        }
        if (entry.contains("/search") || entry.contains("/collections")) {
            return JourneyType.SEARCH;
        }
        if (isProductPage(entry)) {
            return JourneyType.DIRECT_TO_PRODUCT;
        }
        return JourneyType.OTHER;
    }

    int deepestStage(Session session) {
        int deepest = ENTRY;
        for (String page : pathOf(session)) {
            deepest = Math.max(deepest, stageOf(page));
        }
        return session.isConverted() ? PURCHASE : deepest;
    }

    private static int stageOf(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (isPurchasePage(lower)) return PURCHASE;
        if (isCheckoutPage(lower)) return CHECKOUT;
        if (isCartPage(lower)) return CART;
        if (isProductPage(lower)) return PRODUCT;
        return ENTRY;
    }

    private static List<String> pagesForStage(String[] path, int stage) {
        if (stage == ENTRY) {
            return path.length > 0 ? List.of(path[0]) : List.of();
        }
        List<String> pages = new ArrayList<>();
        for (String page : path) {
            if (stageOf(page) == stage) {
                pages.add(page);
            }
        }
        return pages;
    }

    private static List<FunnelReport.StagePage> topPages(Map<String, Integer> pages) {
        return pages.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_PAGES)
                .map(entry -> new FunnelReport.StagePage(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static List<Integer> positionReach(List<Session> sessions) {
        int longest = sessions.stream().mapToInt(s -> pathOf(s).length).max().orElse(0);
        int positions = Math.min(longest, MAX_POSITIONS);
        List<Integer> reach = new ArrayList<>(positions);
        for (int i = 0; i < positions; i++) {
            final int position = i;
            reach.add((int) sessions.stream().filter(s -> pathOf(s).length > position).count());
        }
        return reach;
    }

    public static boolean isProductPage(String url) {
        return url.contains("/product") || url.contains("/item") || url.equals("/p") || url.contains("/p/");
    }

    public static boolean isCartPage(String url) {
        return url.contains("/cart") || url.contains("/basket");
    }

    public static boolean isCheckoutPage(String url) {
        return url.contains("/checkout") || url.contains("/payment");
    }

    public static boolean isPurchasePage(String url) {
        return url.contains("/confirm") || url.contains("/thank") || url.contains("/success")
                || url.contains("/order-complete");
    }

    private static String[] pathOf(Session session) {
        return session.getJourneyPath() != null ? session.getJourneyPath() : new String[0];
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
