package dev.metricfortune.controller;

import dev.metricfortune.dto.TrackRequest;
import dev.metricfortune.service.tracking.TrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/track")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Storefront event ingestion")
public class TrackingController {

    private final TrackingService trackingService;

    @PostMapping
    @Operation(summary = "Ingest events", description = "Accepts a batch of events from one site")
    public Mono<ResponseEntity<Map<String, Object>>> track(@Valid @RequestBody TrackRequest request) {
        log.debug("Received {} tracking events", request.getEvents().size());
        return trackingService.track(request)
                .map(decision -> ResponseEntity.ok()
                        .headers(decision::writeTo)
                        .body(Map.<String, Object>of("success", true)));
    }
}
