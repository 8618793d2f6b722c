package dev.metricfortune.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.metricfortune.entity.Pattern;
import dev.metricfortune.entity.PatternMetadata;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.StringJoiner;

@RequiredArgsConstructor
public class PatternRepositoryImpl implements PatternRepositoryCustom {

    private final R2dbcEntityTemplate r2dbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_PREFIX =
            "INSERT INTO patterns (id, site_id, pattern_type, pattern_key, description, severity, session_count, " +
            "confidence_score, metadata, window_start, window_end, detected_at) VALUES ";

    private static final String ON_CONFLICT_SKIP =
            " ON CONFLICT (site_id, pattern_type, pattern_key, window_start) DO NOTHING";

    @Override
    public Mono<Long> insertAllSkipDuplicates(List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> buildInsert(patterns))
                .flatMap(spec -> spec.fetch().rowsUpdated());
    }

    private DatabaseClient.GenericExecuteSpec buildInsert(List<Pattern> patterns) throws JsonProcessingException {
        StringJoiner values = new StringJoiner(", ", INSERT_PREFIX, ON_CONFLICT_SKIP);
        for (int i = 0; i < patterns.size(); i++) {
            values.add("(:id" + i + ", :site" + i + ", :type" + i + ", :key" + i + ", :description" + i
                    + ", :severity" + i + ", :sessions" + i + ", :confidence" + i + ", :metadata" + i
                    + ", :windowStart" + i + ", :windowEnd" + i + ", :detected" + i + ")");
        }

        DatabaseClient.GenericExecuteSpec spec = r2dbcTemplate.getDatabaseClient().sql(values.toString());
        for (int i = 0; i < patterns.size(); i++) {
            Pattern pattern = patterns.get(i);
            String metadataJson = objectMapper.writerFor(PatternMetadata.class).writeValueAsString(pattern.getMetadata());
            spec = spec.bind("id" + i, pattern.getId())
                    .bind("site" + i, pattern.getSiteId())
                    .bind("type" + i, pattern.getPatternType())
                    .bind("key" + i, pattern.getPatternKey())
                    .bind("description" + i, pattern.getDescription())
                    .bind("severity" + i, pattern.getSeverity())
                    .bind("sessions" + i, pattern.getSessionCount())
                    .bind("confidence" + i, pattern.getConfidenceScore())
                    .bind("metadata" + i, Json.of(metadataJson))
                    .bind("windowStart" + i, pattern.getWindowStart())
                    .bind("windowEnd" + i, pattern.getWindowEnd())
                    .bind("detected" + i, pattern.getDetectedAt());
        }
        return spec;
    }
}
