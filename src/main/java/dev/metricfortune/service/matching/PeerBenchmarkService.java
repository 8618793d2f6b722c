package dev.metricfortune.service.matching;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.PeerBenchmark;
import dev.metricfortune.entity.Business;
import dev.metricfortune.entity.PeerGroup;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.repository.PeerGroupRepository;
import dev.metricfortune.repository.SessionRepository;
import dev.metricfortune.service.BusinessAccessService;
import dev.metricfortune.service.matching.PeerMetricsCalculator.Metric;
import dev.metricfortune.service.matching.PeerMetricsCalculator.PercentileRank;
import dev.metricfortune.service.matching.PeerMetricsCalculator.SiteMetrics;
import dev.metricfortune.util.Rates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Compares a business's conversion, cart abandonment and bounce rates with its peer group,
 * each site measured over its latest sessions.
 */
@Service
@Slf4j
public class PeerBenchmarkService {

    private final BusinessAccessService businessAccessService;
    private final BusinessRepository businessRepository;
    private final PeerGroupRepository peerGroupRepository;
    private final SessionRepository sessionRepository;
    private final PeerMetricsCalculator calculator;
    private final ResilienceConfig resilience;
    private final int minAcceptableGroupSize;
    private final int minSessions;
    private final int sessionsPerBusiness;

    public PeerBenchmarkService(BusinessAccessService businessAccessService,
                                BusinessRepository businessRepository,
                                PeerGroupRepository peerGroupRepository,
                                SessionRepository sessionRepository,
                                PeerMetricsCalculator calculator,
                                ResilienceConfig resilience,
                                @Value("${insights.peers.min-acceptable-group-size:5}") int minAcceptableGroupSize,
                                @Value("${insights.peers.min-sessions:100}") int minSessions,
                                @Value("${insights.peers.sessions-per-business:1000}") int sessionsPerBusiness) {
        this.businessAccessService = businessAccessService;
        this.businessRepository = businessRepository;
        this.peerGroupRepository = peerGroupRepository;
        this.sessionRepository = sessionRepository;
        this.calculator = calculator;
        this.resilience = resilience;
        this.minAcceptableGroupSize = minAcceptableGroupSize;
        this.minSessions = minSessions;
        this.sessionsPerBusiness = sessionsPerBusiness;
    }

    public Mono<PeerBenchmark> benchmark(Long businessId, String userId) {
        return businessAccessService.requireOwned(businessId, userId)
                .flatMap(this::benchmark);
    }

    Mono<PeerBenchmark> benchmark(Business business) {
        if (business.getPeerGroupId() == null) {
            return Mono.just(PeerBenchmark.insufficientData(PeerBenchmark.PENDING,
                    "Peer matching has not run for this business yet.", null));
        }
        return peerGroupRepository.findById(business.getPeerGroupId())
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .flatMap(group -> compare(business, group))
                .defaultIfEmpty(PeerBenchmark.insufficientData(PeerBenchmark.PENDING,
                        "Peer matching has not run for this business yet.", null));
    }

    private Mono<PeerBenchmark> compare(Business business, PeerGroup group) {
        List<Long> peerIds = group.getBusinessIds() == null ? List.of() : Arrays.stream(group.getBusinessIds())
                .filter(id -> !Objects.equals(id, business.getId()))
                .toList();
        PeerBenchmark.Group groupInfo = describe(business, group, peerIds.size());

        if (peerIds.size() < minAcceptableGroupSize) {
            return Mono.just(PeerBenchmark.insufficientData(PeerBenchmark.INSUFFICIENT_PEERS,
                    "Not enough similar businesses yet: " + peerIds.size() + " found, "
                            + minAcceptableGroupSize + " needed.", groupInfo));
        }

        return metricsForSite(business.getSiteId())
                .flatMap(own -> {
                    if (own.sessionCount() < minSessions) {
                        return Mono.just(PeerBenchmark.insufficientData(PeerBenchmark.INSUFFICIENT_SESSIONS,
                                "Benchmarks need at least " + minSessions + " sessions; your store has "
                                        + own.sessionCount() + ".", groupInfo));
                    }
                    return businessRepository.findAllById(peerIds)
                            .filter(peer -> peer.getSiteId() != null)
                            .concatMap(peer -> metricsForSite(peer.getSiteId()))
                            .filter(metrics -> metrics.sessionCount() > 0)
                            .collectList()
                            .map(peers -> {
                                log.debug("Benchmarking business {} against {} peers with data",
                                        business.getId(), peers.size());
                                return PeerBenchmark.builder()
                                        .status(PeerBenchmark.OK)
                                        .peerGroup(groupInfo)
                                        .comparisons(comparisons(own, peers))
                                        .build();
                            });
                });
    }

    List<PeerBenchmark.Comparison> comparisons(SiteMetrics own, List<SiteMetrics> peers) {
        SiteMetrics average = calculator.average(peers);
        return Arrays.stream(Metric.values())
                .map(metric -> {
                    double value = metric.valueOf(own);
                    double peerAverage = metric.valueOf(average);
                    PercentileRank rank = calculator.percentile(value,
                            peers.stream().map(metric::valueOf).toList(), metric.higherIsBetter());
                    return PeerBenchmark.Comparison.builder()
                            .metric(metric.name().toLowerCase(Locale.ROOT))
                            .label(metric.label())
                            .value(Rates.round1(value))
                            .peerAverage(Rates.round1(peerAverage))
                            .performance(calculator.performance(value, peerAverage))
                            .percentile(rank.bucket())
                            .percentileValue(rank.value())
                            .explanation(calculator.explanation(metric, value, peerAverage, rank.value()))
                            .build();
                })
                .toList();
    }

    private Mono<SiteMetrics> metricsForSite(String siteId) {
        return sessionRepository.findLatestBySiteId(siteId, sessionsPerBusiness)
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .map(calculator::metricsFor);
    }

    private static PeerBenchmark.Group describe(Business business, PeerGroup group, int peerCount) {
        return PeerBenchmark.Group.builder()
                .id(group.getId())
                .tier(group.getTier())
                .businessCount(peerCount)
                .industry(business.getIndustry())
                .revenueRange(business.getRevenueRange())
                .description("Compared to " + peerCount + " " + business.getIndustry() + " businesses, "
                        + business.getRevenueRange() + " revenue")
                .build();
    }
}
