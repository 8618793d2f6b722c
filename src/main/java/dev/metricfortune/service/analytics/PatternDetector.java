package dev.metricfortune.service.analytics;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.AnalysisWindow;
import dev.metricfortune.dto.FormInteraction;
import dev.metricfortune.dto.SiteDetectionResult;
import dev.metricfortune.dto.StoreResult;
import dev.metricfortune.entity.AbandonmentMetadata;
import dev.metricfortune.entity.EngagementMetadata;
import dev.metricfortune.entity.HesitationMetadata;
import dev.metricfortune.entity.Pattern;
import dev.metricfortune.entity.PatternMetadata;
import dev.metricfortune.entity.Session;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.repository.SessionRepository;
import dev.metricfortune.repository.TrackingEventRepository;
import dev.metricfortune.service.IdService;
import dev.metricfortune.util.Rates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.metricfortune.service.analytics.PatternScoring.ABANDONMENT_RATE;
import static dev.metricfortune.service.analytics.PatternScoring.HESITATION_RATE;
import static dev.metricfortune.service.analytics.PatternScoring.LOW_ENGAGEMENT_RATIO;
import static dev.metricfortune.service.analytics.PatternScoring.MIN_PAGEVIEWS_PER_URL;
import static dev.metricfortune.service.analytics.PatternScoring.MIN_SESSIONS;

/**
 * Finds friction in a site's sessions over an analysis window.
 *
 * <ul>
 *   <li><b>Abandonment</b>: journey stages where at least 30% of the sessions stop.</li>
 *   <li><b>Hesitation</b>: form fields focused more than once per session by at least 20% of the
 *       sessions that touch them.</li>
 *   <li><b>Low engagement</b>: pages whose approximate time-on-page is under 70% of the site average.</li>
 * </ul>
 *
 * A site with fewer than {@value PatternScoring#MIN_SESSIONS} sessions in the window yields no patterns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternDetector {

    private final SessionRepository sessionRepository;
    private final TrackingEventRepository trackingEventRepository;
    private final PatternRepository patternRepository;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;

    public Mono<List<Pattern>> detect(String siteId, AnalysisWindow window) {
        long started = System.currentTimeMillis();
        log.debug("Starting pattern detection for site {} ({} to {})", siteId, window.start(), window.end());

        return sessionRepository.findInWindow(siteId, window.start(), window.end())
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .flatMap(sessions -> {
                    if (sessions.size() < MIN_SESSIONS) {
                        log.info("Insufficient data for site {}: {} sessions, {} required",
                                siteId, sessions.size(), MIN_SESSIONS);
                        return Mono.just(List.<Pattern>of());
                    }
                    LocalDateTime detectedAt = LocalDateTime.now(ZoneOffset.UTC);
                    return detectHesitation(siteId, window, detectedAt)
                            .map(hesitation -> {
                                List<Pattern> all = new ArrayList<>(detectAbandonment(siteId, sessions, window, detectedAt));
                                all.addAll(hesitation);
                                all.addAll(detectLowEngagement(siteId, sessions, window, detectedAt));
                                List<Pattern> significant = all.stream()
                                        .filter(p -> p.getSessionCount() >= MIN_SESSIONS)
                                        .toList();
                                log.info("Detected {} patterns for site {} ({} below threshold) in {}ms",
                                        significant.size(), siteId, all.size() - significant.size(),
                                        System.currentTimeMillis() - started);
                                return significant;
                            });
                });
    }

    /**
     * Per stage: sessions that visited it versus sessions that moved on to any next page.
     */
    List<Pattern> detectAbandonment(String siteId, List<Session> sessions, AnalysisWindow window,
                                    LocalDateTime detectedAt) {
        Map<String, int[]> stageCounts = new LinkedHashMap<>(); // stage -> {visits, continuations}
        for (Session session : sessions) {
            String[] path = session.getJourneyPath();
            if (path == null) continue;
            for (int i = 0; i < path.length; i++) {
                int[] counts = stageCounts.computeIfAbsent(path[i], k -> new int[2]);
                counts[0]++;
                if (i < path.length - 1) {
                    counts[1]++;
                }
            }
        }

        List<Pattern> patterns = new ArrayList<>();
        stageCounts.forEach((stage, counts) -> {
            int visits = counts[0];
            if (visits < MIN_SESSIONS) return;
            int abandoned = visits - counts[1];
            double abandonRate = Rates.percent(abandoned, visits);
            if (abandonRate < ABANDONMENT_RATE) return;

            AbandonmentMetadata metadata = new AbandonmentMetadata(stage, Rates.round2(abandonRate), abandoned, visits);
            patterns.add(toPattern(siteId, metadata,
                    PatternScoring.severity(abandonRate / 100, visits, sessions.size()),
                    visits, window, detectedAt));
        });
        log.debug("Found {} abandonment patterns for site {}", patterns.size(), siteId);
        return patterns;
    }

    Mono<List<Pattern>> detectHesitation(String siteId, AnalysisWindow window, LocalDateTime detectedAt) {
        return trackingEventRepository.findFormInteractions(siteId, window.start(), window.end())
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .map(interactions -> hesitationPatterns(siteId, interactions, window, detectedAt))
                .onErrorResume(e -> {
                    // hesitation needs raw events; the other families still run without them
                    log.error("Hesitation detection failed for site {}: {}", siteId, e.getMessage(), e);
                    return Mono.just(List.of());
                });
    }

    List<Pattern> hesitationPatterns(String siteId, List<FormInteraction> interactions, AnalysisWindow window,
                                     LocalDateTime detectedAt) {
        // field -> session -> focus count
        Map<String, Map<String, Integer>> focusByField = new LinkedHashMap<>();
        for (FormInteraction interaction : interactions) {
            if (interaction.field() == null || interaction.field().isBlank()) continue;
            Map<String, Integer> sessions = focusByField.computeIfAbsent(interaction.field(), k -> new LinkedHashMap<>());
            sessions.merge(interaction.sessionId(), interaction.isFocus() ? 1 : 0, Integer::sum);
        }

        List<Pattern> patterns = new ArrayList<>();
        focusByField.forEach((field, sessions) -> {
            int sessionCount = sessions.size();
            if (sessionCount < MIN_SESSIONS) return;
            List<Integer> reEntering = sessions.values().stream().filter(focus -> focus > 1).toList();
            double reEntryRate = Rates.percent(reEntering.size(), sessionCount);
            if (reEntryRate < HESITATION_RATE) return;

            double avgReEntries = reEntering.stream().mapToInt(Integer::intValue).average().orElse(0);
            HesitationMetadata metadata = new HesitationMetadata(field, Rates.round2(reEntryRate),
                    Rates.round2(avgReEntries), reEntering.size(), sessionCount);
            patterns.add(toPattern(siteId, metadata,
                    PatternScoring.severity(reEntryRate / 100, reEntering.size(), sessionCount),
                    sessionCount, window, detectedAt));
        });
        log.debug("Found {} hesitation patterns for site {}", patterns.size(), siteId);
        return patterns;
    }

    /**
     * Time-on-page is approximated as {@code duration / pageCount} for every page of a session.
     */
    List<Pattern> detectLowEngagement(String siteId, List<Session> sessions, AnalysisWindow window,
                                      LocalDateTime detectedAt) {
        Map<String, double[]> pageStats = new LinkedHashMap<>(); // page -> {total seconds, pageviews}
        for (Session session : sessions) {
            Integer duration = session.getDuration();
            if (duration == null || duration == 0 || session.getPageCount() == 0 || session.getJourneyPath() == null) {
                continue;
            }
            double timePerPage = (double) duration / session.getPageCount();
            for (String page : session.getJourneyPath()) {
                double[] stats = pageStats.computeIfAbsent(page, k -> new double[2]);
                stats[0] += timePerPage;
                stats[1]++;
            }
        }

        double totalTime = pageStats.values().stream().mapToDouble(s -> s[0]).sum();
        double totalPageviews = pageStats.values().stream().mapToDouble(s -> s[1]).sum();
        if (totalPageviews == 0) {
            return List.of();
        }
        double siteAverage = totalTime / totalPageviews;
        double threshold = siteAverage * LOW_ENGAGEMENT_RATIO;

        List<Pattern> patterns = new ArrayList<>();
        pageStats.forEach((page, stats) -> {
            int pageviews = (int) stats[1];
            if (pageviews < MIN_PAGEVIEWS_PER_URL) return;
            double avgTimeOnPage = stats[0] / pageviews;
            if (avgTimeOnPage >= threshold) return;

            double engagementGap = (siteAverage - avgTimeOnPage) / siteAverage * 100;
            EngagementMetadata metadata = new EngagementMetadata(page, Rates.round2(avgTimeOnPage),
                    Rates.round2(siteAverage), Rates.round2(engagementGap), pageviews, pageviews);
            patterns.add(toPattern(siteId, metadata,
                    PatternScoring.severity(engagementGap / 100, pageviews, sessions.size()),
                    pageviews, window, detectedAt));
        });
        log.debug("Found {} low engagement patterns for site {}", patterns.size(), siteId);
        return patterns;
    }

    /**
     * Bulk insert skipping duplicates. When the bulk statement fails, each pattern is retried on its
     * own so one bad row does not block the rest; failures are collected, not thrown.
     */
    public Mono<StoreResult> store(List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            return Mono.just(StoreResult.empty());
        }
        return patternRepository.insertAllSkipDuplicates(patterns)
                .timeout(resilience.getDatabaseTimeout())
                .map(created -> new StoreResult(created, List.of()))
                .onErrorResume(e -> {
                    log.error("Bulk pattern insert failed, storing {} patterns individually: {}",
                            patterns.size(), e.getMessage());
                    return storeIndividually(patterns, "Bulk insert failed: " + e.getMessage());
                })
                .doOnNext(result -> metrics.recordPatternsStored(result.created()));
    }

    private Mono<StoreResult> storeIndividually(List<Pattern> patterns, String bulkError) {
        List<String> errors = new ArrayList<>();
        errors.add(bulkError);
        return Flux.fromIterable(patterns)
                .concatMap(pattern -> patternRepository.insertAllSkipDuplicates(List.of(pattern))
                        .timeout(resilience.getDatabaseTimeout())
                        .onErrorResume(e -> {
                            log.warn("Failed to store {} pattern {} for site {}: {}", pattern.getPatternType(),
                                    pattern.getPatternKey(), pattern.getSiteId(), e.getMessage());
                            errors.add("Failed to create pattern " + pattern.getPatternKey() + ": " + e.getMessage());
                            return Mono.just(0L);
                        }))
                .reduce(0L, Long::sum)
                .map(created -> new StoreResult(created, List.copyOf(errors)));
    }

    public Mono<SiteDetectionResult> detectAndStore(String siteId, AnalysisWindow window) {
        return detect(siteId, window)
                .flatMap(patterns -> store(patterns)
                        .map(stored -> new SiteDetectionResult(siteId, patterns.size(), stored.created(), stored.errors())));
    }

    private Pattern toPattern(String siteId, PatternMetadata metadata, double severity, int sessionCount,
                              AnalysisWindow window, LocalDateTime detectedAt) {
        return Pattern.builder()
                .id(idService.nextId())
                .siteId(siteId)
                .patternType(metadata.type().name())
                .patternKey(metadata.subject())
                .description(metadata.summary())
                .severity(severity)
                .sessionCount(sessionCount)
                .confidenceScore(PatternScoring.confidence(sessionCount))
                .metadata(metadata)
                .windowStart(window.start())
                .windowEnd(window.end())
                .detectedAt(detectedAt)
                .build();
    }
}
