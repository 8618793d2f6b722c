package dev.metricfortune.service;

import dev.metricfortune.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Hands out Snowflake ids for every row this service writes:
 * <pre>
 * TrackingEvent event = TrackingEvent.builder()
 *     .id(idService.nextId())
 *     ...
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    public Instant createdAt(long id) {
        return SnowflakeId.createdAt(id);
    }
}
