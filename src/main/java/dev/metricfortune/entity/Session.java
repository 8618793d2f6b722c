package dev.metricfortune.entity;

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
 * Per-visit aggregate produced upstream from tracking events. Read-only here.
 * {@code journeyPath} is ordered: element {@code i} is the i-th page visited.
 */
@Table("sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session implements Persistable<Long>, NewRecordAware {

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

    @Column("entry_page")
    private String entryPage;

    @Column("exit_page")
    private String exitPage;

    // seconds, null while the session is still open
    private Integer duration;

    @Column("page_count")
    private int pageCount;

    private boolean bounced;

    private boolean converted;

    @Column("journey_path")
    @Builder.Default
    private String[] journeyPath = new String[0];

    @Column("created_at")
    private LocalDateTime createdAt;
}
