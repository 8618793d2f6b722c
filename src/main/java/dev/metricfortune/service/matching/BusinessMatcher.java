package dev.metricfortune.service.matching;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.entity.Business;
import dev.metricfortune.entity.PeerGroup;
import dev.metricfortune.entity.PeerTier;
import dev.metricfortune.exception.ResourceNotFoundException;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.repository.PeerGroupRepository;
import dev.metricfortune.service.IdService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Assigns each business a peer group by loosening the match criteria tier by tier until enough
 * peers are found:
 * <ol>
 *   <li>strict: same industry, same revenue band, product overlap &ge; 0.5, same platform</li>
 *   <li>relaxed: same industry, revenue within one band, product overlap &ge; 0.3</li>
 *   <li>broad: same industry, revenue within two bands</li>
 *   <li>fallback: same industry</li>
 * </ol>
 * The tier used is stored on the group.
 */
@Service
@Slf4j
public class BusinessMatcher {

    private final BusinessRepository businessRepository;
    private final PeerGroupRepository peerGroupRepository;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final int minGroupSize;
    private final int minAcceptableGroupSize;
    private final int maxGroupSize;

    public record TierMatch(PeerTier tier, List<Business> matches) {}

    public record MatchResult(Long peerGroupId, List<Long> businessIds, PeerTier tier, int matchCount) {}

    public record RecalculationReport(int recalculated, int errors) {}

    public BusinessMatcher(BusinessRepository businessRepository,
                           PeerGroupRepository peerGroupRepository,
                           IdService idService,
                           ResilienceConfig resilience,
                           @Value("${insights.peers.min-group-size:10}") int minGroupSize,
                           @Value("${insights.peers.min-acceptable-group-size:5}") int minAcceptableGroupSize,
                           @Value("${insights.peers.max-group-size:50}") int maxGroupSize) {
        this.businessRepository = businessRepository;
        this.peerGroupRepository = peerGroupRepository;
        this.idService = idService;
        this.resilience = resilience;
        this.minGroupSize = minGroupSize;
        this.minAcceptableGroupSize = minAcceptableGroupSize;
        this.maxGroupSize = maxGroupSize;
    }

    /**
     * Computes and persists a fresh peer group for the business, then points the business at it.
     */
    public Mono<MatchResult> findPeerGroup(Long businessId) {
        long started = System.currentTimeMillis();
        return businessRepository.findById(businessId)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.business_not_found")))
                .flatMap(business -> businessRepository.findIndustryPeers(business.getIndustry(), business.getId())
                        .collectList()
                        .timeout(resilience.getDatabaseTimeout())
                        .flatMap(candidates -> {
                            TierMatch match = selectTier(business, candidates);
                            List<Long> memberIds = rankMembers(business, match.matches());
                            PeerGroup group = PeerGroup.builder()
                                    .id(idService.nextId())
                                    .tier(match.tier().name())
                                    .industry(business.getIndustry())
                                    .revenueRange(business.getRevenueRange())
                                    .platform(business.getPlatform())
                                    .productTypes(business.getProductTypes())
                                    .businessIds(memberIds.toArray(Long[]::new))
                                    .createdAt(LocalDateTime.now(ZoneOffset.UTC))
                                    .updatedAt(LocalDateTime.now(ZoneOffset.UTC))
                                    .build();
                            return peerGroupRepository.save(group)
                                    .flatMap(saved -> businessRepository.assignPeerGroup(business.getId(), saved.getId())
                                            .thenReturn(new MatchResult(saved.getId(), memberIds, match.tier(),
                                                    memberIds.size() - 1)));
                        }))
                .doOnNext(result -> log.info("Business {} matched {} peers at {} tier in {}ms", businessId,
                        result.matchCount(), result.tier(), System.currentTimeMillis() - started));
    }

    /**
     * First tier yielding at least {@code minGroupSize} candidates; the industry-only fallback otherwise.
     */
    public TierMatch selectTier(Business business, List<Business> candidates) {
        List<Business> sameIndustry = candidates.stream()
                .filter(c -> !Objects.equals(c.getId(), business.getId()))
                .filter(c -> Objects.equals(c.getIndustry(), business.getIndustry()))
                .toList();

        List<Business> strict = filter(sameIndustry, c ->
                Objects.equals(c.getRevenueRange(), business.getRevenueRange())
                        && SimilarityScoring.jaccard(business.getProductTypes(), c.getProductTypes()) >= 0.5
                        && Objects.equals(c.getPlatform(), business.getPlatform()));
        if (strict.size() >= minGroupSize) {
            return new TierMatch(PeerTier.STRICT, strict);
        }

        List<Business> relaxed = filter(sameIndustry, c ->
                RevenueRanges.withinTiers(business.getRevenueRange(), c.getRevenueRange(), 1)
                        && SimilarityScoring.jaccard(business.getProductTypes(), c.getProductTypes()) >= 0.3);
        if (relaxed.size() >= minGroupSize) {
            return new TierMatch(PeerTier.RELAXED, relaxed);
        }

        List<Business> broad = filter(sameIndustry, c ->
                RevenueRanges.withinTiers(business.getRevenueRange(), c.getRevenueRange(), 2));
        if (broad.size() >= minGroupSize) {
            return new TierMatch(PeerTier.BROAD, broad);
        }

        if (sameIndustry.size() < minAcceptableGroupSize) {
            log.warn("Only {} industry peers for business {} ({}), minimum is {}", sameIndustry.size(),
                    business.getId(), business.getIndustry(), minAcceptableGroupSize);
        }
        return new TierMatch(PeerTier.FALLBACK, sameIndustry);
    }

    /** Business itself first, then the top {@code maxGroupSize} matches by similarity score. */
    List<Long> rankMembers(Business business, List<Business> matches) {
        List<Long> ids = new ArrayList<>();
        ids.add(business.getId());
        matches.stream()
                .map(candidate -> SimilarityScoring.score(business, candidate))
                .sorted(Comparator.comparingDouble(SimilarityScore::score).reversed())
                .limit(maxGroupSize)
                .forEach(score -> ids.add(score.businessId()));
        return ids;
    }

    /**
     * Recomputes the peer group of every business in the industry, one at a time.
     * A failure for one business is counted and does not stop the rest.
     */
    public Mono<RecalculationReport> recalculateIndustry(String industry, Long excludeBusinessId) {
        return businessRepository.findByIndustry(industry)
                .filter(business -> excludeBusinessId == null || !excludeBusinessId.equals(business.getId()))
                .concatMap(business -> findPeerGroup(business.getId())
                        .thenReturn(true)
                        .onErrorResume(e -> {
                            log.error("Failed to recalculate peer group for business {}: {}",
                                    business.getId(), e.getMessage());
                            return Mono.just(false);
                        }))
                .reduce(new RecalculationReport(0, 0), (report, ok) -> ok
                        ? new RecalculationReport(report.recalculated() + 1, report.errors())
                        : new RecalculationReport(report.recalculated(), report.errors() + 1))
                .doOnNext(report -> log.info("Peer group recalculation for {}: {} recalculated, {} errors",
                        industry, report.recalculated(), report.errors()));
    }

    private static List<Business> filter(List<Business> candidates, Predicate<Business> predicate) {
        return candidates.stream().filter(predicate).toList();
    }
}
