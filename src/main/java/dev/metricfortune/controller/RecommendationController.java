package dev.metricfortune.controller;

import dev.metricfortune.dto.ImplementRecommendationRequest;
import dev.metricfortune.dto.RecommendationFilter;
import dev.metricfortune.dto.RecommendationResponse;
import dev.metricfortune.service.recommendation.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Recommendations", description = "Recommendation listing and lifecycle")
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping("/businesses/{businessId}/recommendations")
    @Operation(summary = "List recommendations", description = "Filter by status and levels, sort by priority or creation date")
    public Mono<List<RecommendationResponse>> list(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long businessId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String impactLevel,
            @RequestParam(required = false) String confidenceLevel,
            @Parameter(description = "priority or createdAt") @RequestParam(defaultValue = "priority") String sortBy,
            @Parameter(description = "asc or desc") @RequestParam(defaultValue = "desc") String sortOrder,
            @RequestParam(defaultValue = "" + RecommendationFilter.DEFAULT_LIMIT) int limit) {
        String caller = CallerHeaders.requireUser(userId);
        log.debug("Listing recommendations for business {}", businessId);
        RecommendationFilter filter = RecommendationFilter.builder()
                .status(status)
                .impactLevel(impactLevel)
                .confidenceLevel(confidenceLevel)
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .limit(limit)
                .build();
        return recommendationService.list(businessId, caller, filter).collectList();
    }

    @GetMapping("/recommendations/{id}")
    @Operation(summary = "Get recommendation")
    public Mono<RecommendationResponse> get(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long id) {
        return recommendationService.get(id, CallerHeaders.requireUser(userId));
    }

    @PostMapping("/recommendations/{id}/plan")
    @Operation(summary = "Mark as planned", description = "Allowed from NEW")
    public Mono<RecommendationResponse> plan(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long id) {
        String caller = CallerHeaders.requireUser(userId);
        log.info("Planning recommendation {}", id);
        return recommendationService.plan(id, caller);
    }

    @PostMapping("/recommendations/{id}/implement")
    @Operation(summary = "Mark as implemented", description = "Allowed from NEW or PLANNED")
    public Mono<RecommendationResponse> implement(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long id,
            @Valid @RequestBody ImplementRecommendationRequest request) {
        String caller = CallerHeaders.requireUser(userId);
        log.info("Implementing recommendation {}", id);
        return recommendationService.implement(id, caller, request);
    }

    @PostMapping("/recommendations/{id}/dismiss")
    @Operation(summary = "Dismiss", description = "Allowed from NEW or PLANNED")
    public Mono<RecommendationResponse> dismiss(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @PathVariable Long id) {
        String caller = CallerHeaders.requireUser(userId);
        log.info("Dismissing recommendation {}", id);
        return recommendationService.dismiss(id, caller);
    }
}
