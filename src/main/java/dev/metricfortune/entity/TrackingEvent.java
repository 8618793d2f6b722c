package dev.metricfortune.entity;

import io.r2dbc.postgresql.codec.Json;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Raw client-side telemetry. Never updated; rows past the retention window are deleted
 * by {@link dev.metricfortune.scheduler.TrackingRetentionJob}.
 */
@Table("tracking_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingEvent implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("site_id")
    private String siteId;

    @Column("session_id")
    private String sessionId;

    @Column("event_type")
    private String eventType; // pageview, click, form, scroll, time

    // client clock, UTC
    private LocalDateTime timestamp;

    // free-form payload as sent by the tracking script
    private Json data;

    @Column("created_at")
    private LocalDateTime createdAt;
}
