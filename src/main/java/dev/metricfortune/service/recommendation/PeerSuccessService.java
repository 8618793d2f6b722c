package dev.metricfortune.service.recommendation;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.repository.PeerGroupRepository;
import dev.metricfortune.repository.RecommendationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Looks up how many peers implemented a recommendation with a similar title (same first three words).
 * Success rate and improvement are fixed assumptions until impact tracking exists.
 */
@Service
@Slf4j
public class PeerSuccessService {

    private static final int TITLE_WORDS = 3;
    private static final Pattern LIKE_SPECIAL = Pattern.compile("([%_\\\\])");

    private final BusinessRepository businessRepository;
    private final PeerGroupRepository peerGroupRepository;
    private final RecommendationRepository recommendationRepository;
    private final ResilienceConfig resilience;
    private final double assumedSuccessRate;
    private final double assumedImprovementPercent;

    public PeerSuccessService(BusinessRepository businessRepository,
                              PeerGroupRepository peerGroupRepository,
                              RecommendationRepository recommendationRepository,
                              ResilienceConfig resilience,
                              @Value("${insights.recommendations.assumed-success-rate:0.75}") double assumedSuccessRate,
                              @Value("${insights.recommendations.assumed-improvement-percent:18}") double assumedImprovementPercent) {
        this.businessRepository = businessRepository;
        this.peerGroupRepository = peerGroupRepository;
        this.recommendationRepository = recommendationRepository;
        this.resilience = resilience;
        this.assumedSuccessRate = assumedSuccessRate;
        this.assumedImprovementPercent = assumedImprovementPercent;
    }

    /**
     * Completes empty when the business has no peer group, the group has no other member,
     * or no peer implemented a similar recommendation. Lookup failures also complete empty.
     */
    public Mono<PeerSuccessStats> peerSuccess(Long businessId, String title) {
        return businessRepository.findById(businessId)
                .filter(business -> business.getPeerGroupId() != null)
                .flatMap(business -> peerGroupRepository.findById(business.getPeerGroupId()))
                .filter(group -> group.getBusinessIds() != null && group.getBusinessIds().length > 1)
                .flatMap(group -> {
                    Long[] peers = Arrays.stream(group.getBusinessIds())
                            .filter(id -> !Objects.equals(id, businessId))
                            .toArray(Long[]::new);
                    return recommendationRepository.findImplementedByTitleLike(peers, titlePattern(title))
                            .count()
                            .filter(count -> count > 0)
                            .map(count -> new PeerSuccessStats(group.getBusinessIds().length - 1, count.intValue(),
                                    assumedSuccessRate, assumedImprovementPercent));
                })
                .timeout(resilience.getDatabaseTimeout())
                .onErrorResume(e -> {
                    log.error("Peer success lookup failed for business {}: {}", businessId, e.getMessage());
                    return Mono.empty();
                });
    }

    /** {@code ILIKE} pattern on the first three words of the title. */
    static String titlePattern(String title) {
        String prefix = Arrays.stream(title.trim().split("\\s+"))
                .limit(TITLE_WORDS)
                .collect(Collectors.joining(" "));
        return "%" + LIKE_SPECIAL.matcher(prefix).replaceAll("\\\\$1") + "%";
    }
}
