package dev.metricfortune.repository;

import dev.metricfortune.dto.FormInteraction;
import dev.metricfortune.entity.EventType;
import dev.metricfortune.entity.TrackingEvent;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.StringJoiner;

/**
 * Raw SQL for the ingestion write path and the hesitation read path.
 */
@RequiredArgsConstructor
public class TrackingEventRepositoryImpl implements TrackingEventRepositoryCustom {

    private final R2dbcEntityTemplate r2dbcTemplate;

    // seven binds per row; PostgreSQL caps a statement at 65535 parameters
    static final int MAX_ROWS_PER_STATEMENT = 1000;

    private static final String INSERT_PREFIX =
            "INSERT INTO tracking_events (id, site_id, session_id, event_type, timestamp, data, created_at) VALUES ";

    private static final String ON_CONFLICT_SKIP = " ON CONFLICT (id) DO NOTHING";

    private static final String FIND_FORM_INTERACTIONS =
            "SELECT session_id, COALESCE(data->>'field', data->>'name') AS field, data->>'action' AS action " +
            "FROM tracking_events " +
            "WHERE site_id = :siteId AND event_type = :eventType AND timestamp >= :from AND timestamp <= :to " +
            "ORDER BY session_id, timestamp";

    @Override
    public Mono<Long> insertAllSkipDuplicates(List<TrackingEvent> events) {
        if (events.isEmpty()) {
            return Mono.just(0L);
        }
        return Flux.fromIterable(events)
                .buffer(MAX_ROWS_PER_STATEMENT)
                .concatMap(chunk -> Mono.fromCallable(() -> buildInsert(chunk))
                        .flatMap(spec -> spec.fetch().rowsUpdated()))
                .reduce(0L, Long::sum);
    }

    private DatabaseClient.GenericExecuteSpec buildInsert(List<TrackingEvent> events) {
        StringJoiner values = new StringJoiner(", ", INSERT_PREFIX, ON_CONFLICT_SKIP);
        for (int i = 0; i < events.size(); i++) {
            values.add("(:id" + i + ", :site" + i + ", :session" + i + ", :type" + i
                    + ", :ts" + i + ", :data" + i + ", :created" + i + ")");
        }

        DatabaseClient.GenericExecuteSpec spec = r2dbcTemplate.getDatabaseClient().sql(values.toString());
        for (int i = 0; i < events.size(); i++) {
            TrackingEvent event = events.get(i);
            spec = spec.bind("id" + i, event.getId())
                    .bind("site" + i, event.getSiteId())
                    .bind("session" + i, event.getSessionId())
                    .bind("type" + i, event.getEventType())
                    .bind("ts" + i, event.getTimestamp())
                    .bind("data" + i, event.getData() != null ? event.getData() : Json.of("{}"))
                    .bind("created" + i, event.getCreatedAt());
        }
        return spec;
    }

    @Override
    public Flux<FormInteraction> findFormInteractions(String siteId, LocalDateTime from, LocalDateTime to) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_FORM_INTERACTIONS)
                .bind("siteId", siteId)
                .bind("eventType", EventType.FORM.wireName())
                .bind("from", from)
                .bind("to", to)
                .map((row, meta) -> new FormInteraction(
                        row.get("session_id", String.class),
                        row.get("field", String.class),
                        row.get("action", String.class)))
                .all();
    }
}
