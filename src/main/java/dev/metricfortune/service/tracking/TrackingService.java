package dev.metricfortune.service.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.RateLimitDecision;
import dev.metricfortune.dto.TrackRequest;
import dev.metricfortune.entity.TrackingEvent;
import dev.metricfortune.exception.RateLimitExceededException;
import dev.metricfortune.exception.SiteNotRegisteredException;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.BusinessRepository;
import dev.metricfortune.service.IdService;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Ingestion path behind {@code POST /api/track}: site check, quota, mapping, hand-off to the sink.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    private final BusinessRepository businessRepository;
    private final SiteRateLimiter rateLimiter;
    private final EventSink eventSink;
    private final IdService idService;
    private final ObjectMapper objectMapper;
    private final ResilienceConfig resilience;
    private final PipelineMetrics metrics;

    /**
     * Accepts one batch. Emits the quota decision so the caller can echo the rate headers.
     *
     * @throws IllegalArgumentException    when the batch mixes sites
     * @throws SiteNotRegisteredException  when no business owns the site
     * @throws RateLimitExceededException  when the site is over its quota
     */
    public Mono<RateLimitDecision> track(TrackRequest request) {
        List<TrackRequest.TrackedEvent> events = request.getEvents();
        String siteId = events.get(0).getSiteId();
        boolean mixed = events.stream().anyMatch(e -> !siteId.equals(e.getSiteId()));
        if (mixed) {
            return Mono.error(new IllegalArgumentException("error.mixed_site_batch"));
        }

        return businessRepository.existsBySiteId(siteId)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .flatMap(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        return Mono.error(new SiteNotRegisteredException(siteId));
                    }
                    return rateLimiter.check(SiteRateLimiter.trackingKey(siteId));
                })
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        metrics.recordRateLimited();
                        return Mono.error(new RateLimitExceededException(decision));
                    }
                    List<TrackingEvent> mapped = events.stream().map(this::toEntity).toList();
                    return eventSink.submit(mapped)
                            .doOnSuccess(ignored -> {
                                metrics.recordAccepted(mapped.size());
                                log.debug("Accepted {} events for site {}", mapped.size(), siteId);
                            })
                            .thenReturn(decision);
                });
    }

    TrackingEvent toEntity(TrackRequest.TrackedEvent tracked) {
        TrackRequest.EventPayload payload = tracked.getEvent();
        return TrackingEvent.builder()
                .id(idService.nextId())
                .siteId(tracked.getSiteId())
                .sessionId(tracked.getSessionId())
                .eventType(payload.getType())
                .timestamp(LocalDateTime.ofInstant(Instant.ofEpochMilli(payload.getTimestamp()), ZoneOffset.UTC))
                .data(toJson(payload.getData()))
                .createdAt(LocalDateTime.now(ZoneOffset.UTC))
                .build();
    }

    private Json toJson(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Json.of("{}");
        }
        try {
            return Json.of(objectMapper.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("error.invalid_request_data", e);
        }
    }
}
