package dev.metricfortune.controller;

import dev.metricfortune.dto.FunnelReport;
import dev.metricfortune.dto.PatternResponse;
import dev.metricfortune.dto.PeerBenchmark;
import dev.metricfortune.service.analytics.InsightsService;
import dev.metricfortune.service.matching.PeerBenchmarkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/businesses/{businessId}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Insights", description = "Journey funnel, detected patterns and peer benchmarks")
public class InsightsController {

    private final InsightsService insightsService;
    private final PeerBenchmarkService peerBenchmarkService;

    @GetMapping("/funnel")
    @Operation(summary = "Journey funnel", description = "Entry to purchase funnel over the last N days")
    public Mono<FunnelReport> funnel(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long businessId,
            @Parameter(description = "all, homepage, search, direct-to-product or other")
            @RequestParam(defaultValue = "all") String journeyType,
            @RequestParam(defaultValue = "7") int days) {
        return insightsService.funnel(businessId, CallerHeaders.requireUser(userId), journeyType, days);
    }

    @GetMapping("/patterns")
    @Operation(summary = "Recent patterns", description = "Most recently detected patterns for the business's site")
    public Mono<List<PatternResponse>> patterns(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long businessId,
            @RequestParam(defaultValue = "20") int limit) {
        return insightsService.recentPatterns(businessId, CallerHeaders.requireUser(userId), limit).collectList();
    }

    @GetMapping("/peer-benchmarks")
    @Operation(summary = "Peer benchmarks", description = "Conversion, cart abandonment and bounce rate against the peer group")
    public Mono<PeerBenchmark> peerBenchmarks(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long businessId) {
        log.debug("Peer benchmark requested for business {}", businessId);
        return peerBenchmarkService.benchmark(businessId, CallerHeaders.requireUser(userId));
    }
}
