package dev.metricfortune.service.analytics;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.AnalysisWindow;
import dev.metricfortune.dto.FunnelReport;
import dev.metricfortune.dto.PatternResponse;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.repository.SessionRepository;
import dev.metricfortune.service.BusinessAccessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Read side of the analytics pipeline for a business owner: journey funnel and recent patterns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsightsService {

    public static final int MAX_DAYS = 90;
    public static final int MAX_PATTERNS = 100;

    private final BusinessAccessService businessAccessService;
    private final SessionRepository sessionRepository;
    private final PatternRepository patternRepository;
    private final JourneyFunnelCalculator funnelCalculator;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<FunnelReport> funnel(Long businessId, String userId, String journeyType, int days) {
        if (days < 1 || days > MAX_DAYS) {
            return Mono.error(new IllegalArgumentException("error.invalid_request_params"));
        }
        JourneyType type = journeyType == null ? JourneyType.ALL : JourneyType.fromWire(journeyType).orElse(null);
        if (type == null) {
            return Mono.error(new IllegalArgumentException("error.invalid_journey_type"));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        AnalysisWindow window = new AnalysisWindow(now.minusDays(days), now);

        return businessAccessService.requireOwned(businessId, userId)
                .flatMap(business -> sessionRepository.findInWindow(business.getSiteId(), window.start(), window.end())
                        .collectList()
                        .timeout(resilience.getDatabaseTimeout())
                        .retryWhen(resilience.databaseRetry()))
                .map(sessions -> {
                    log.debug("Building {} funnel for business {} from {} sessions", type.wireName(), businessId,
                            sessions.size());
                    return funnelCalculator.calculate(sessions, type, window);
                });
    }

    public Flux<PatternResponse> recentPatterns(Long businessId, String userId, int limit) {
        if (limit < 1 || limit > MAX_PATTERNS) {
            return Flux.error(new IllegalArgumentException("error.invalid_limit"));
        }
        return businessAccessService.requireOwned(businessId, userId)
                .flatMapMany(business -> patternRepository.findRecentBySiteId(business.getSiteId(), limit)
                        .timeout(resilience.getDatabaseTimeout()))
                .map(PatternResponse::from);
    }
}
