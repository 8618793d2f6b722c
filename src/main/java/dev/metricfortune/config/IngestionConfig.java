package dev.metricfortune.config;

import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.TrackingEventRepository;
import dev.metricfortune.service.tracking.BufferedEventSink;
import dev.metricfortune.service.tracking.DirectEventSink;
import dev.metricfortune.service.tracking.EventBuffer;
import dev.metricfortune.service.tracking.EventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the ingestion write path with {@code tracking.ingest.mode}: {@code buffered} (default)
 * or {@code direct}.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class IngestionConfig {

    @Bean
    public EventSink eventSink(@Value("${tracking.ingest.mode:buffered}") String mode,
                               EventBuffer eventBuffer,
                               TrackingEventRepository repository,
                               ResilienceConfig resilience,
                               PipelineMetrics metrics) {
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        log.info("Tracking ingestion mode: {}", normalized);
        return switch (normalized) {
            case "buffered" -> new BufferedEventSink(eventBuffer);
            case "direct" -> new DirectEventSink(repository, resilience, metrics);
            default -> throw new IllegalStateException("Unknown tracking.ingest.mode: " + mode);
        };
    }
}
