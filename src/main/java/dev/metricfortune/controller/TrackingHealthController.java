package dev.metricfortune.controller;

import dev.metricfortune.health.DatabaseHealthIndicator;
import dev.metricfortune.health.EventBufferHealthIndicator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingestion health for the tracking script's operators: {@code unhealthy} (503) when the database
 * does not answer, {@code degraded} when the event buffer is backing up, {@code healthy} otherwise.
 */
@RestController
@RequestMapping("/api/track/health")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Storefront event ingestion")
public class TrackingHealthController {

    private final DatabaseHealthIndicator databaseHealth;
    private final EventBufferHealthIndicator bufferHealth;

    @GetMapping
    @Operation(summary = "Ingestion health", description = "Database reachability and event buffer backlog")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.zip(databaseHealth.health(), bufferHealth.health())
                .map(tuple -> {
                    Health db = tuple.getT1();
                    Health buffer = tuple.getT2();
                    boolean dbUp = Status.UP.equals(db.getStatus());
                    boolean bufferOk = Status.UP.equals(buffer.getStatus());

                    String status = !dbUp ? "unhealthy" : bufferOk ? "healthy" : "degraded";
                    if (!dbUp) {
                        log.warn("Tracking health unhealthy: database is {}", db.getStatus());
                    }

                    Map<String, Object> database = new LinkedHashMap<>();
                    database.put("status", dbUp ? "up" : "down");
                    database.put("responseTimeMs", db.getDetails().get(DatabaseHealthIndicator.RESPONSE_TIME));

                    Map<String, Object> eventBuffer = new LinkedHashMap<>();
                    eventBuffer.put("status", bufferOk ? "ok" : "warning");
                    eventBuffer.put("size", buffer.getDetails().get("size"));

                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", status);
                    body.put("timestamp", Instant.now().toString());
                    body.put("checks", Map.of("database", database, "eventBuffer", eventBuffer));

                    return ResponseEntity.status(dbUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
                });
    }
}
