package dev.metricfortune.controller;

import dev.metricfortune.dto.GenerationResult;
import dev.metricfortune.dto.SiteDetectionResult;
import dev.metricfortune.scheduler.JobReport;
import dev.metricfortune.scheduler.PatternDetectionJob;
import dev.metricfortune.scheduler.RecommendationGenerationJob;
import dev.metricfortune.service.matching.BusinessMatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Operator triggers for the batch jobs and peer matching. Access is restricted at the gateway.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin - Jobs", description = "On-demand job runs")
public class AdminJobController {

    private final PatternDetectionJob patternDetectionJob;
    private final RecommendationGenerationJob recommendationGenerationJob;
    private final BusinessMatcher businessMatcher;

    @PostMapping("/jobs/pattern-detection")
    @Operation(summary = "Run pattern detection", description = "Detects patterns for all sites, then generates recommendations")
    public Mono<JobReport<SiteDetectionResult>> runPatternDetection() {
        log.info("Manual pattern detection run requested");
        return patternDetectionJob.run()
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.CONFLICT, "error.job_running")));
    }

    @PostMapping("/jobs/recommendations")
    @Operation(summary = "Run recommendation generation", description = "All sites with recent patterns, or one site")
    public Mono<JobReport<GenerationResult>> runRecommendations(@RequestParam(required = false) String siteId) {
        log.info("Manual recommendation generation run requested, site {}", siteId != null ? siteId : "all");
        return recommendationGenerationJob.run(siteId)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.CONFLICT, "error.job_running")));
    }

    @PostMapping("/businesses/{businessId}/peer-group")
    @Operation(summary = "Match peers", description = "Recomputes the peer group of one business")
    public Mono<BusinessMatcher.MatchResult> matchPeers(@PathVariable Long businessId) {
        log.info("Peer matching requested for business {}", businessId);
        return businessMatcher.findPeerGroup(businessId);
    }

    @PostMapping("/industries/{industry}/peer-groups")
    @Operation(summary = "Recalculate industry", description = "Recomputes peer groups for every business in an industry")
    public Mono<BusinessMatcher.RecalculationReport> recalculateIndustry(
            @PathVariable String industry,
            @RequestParam(required = false) Long excludeBusinessId) {
        log.info("Peer group recalculation requested for industry {}", industry);
        return businessMatcher.recalculateIndustry(industry, excludeBusinessId);
    }
}
