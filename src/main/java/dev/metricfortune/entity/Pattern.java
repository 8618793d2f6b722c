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
 * Detector output. Immutable once stored; unique on (site, type, key, window start)
 * so that re-running detection over the same window is a no-op.
 */
@Table("patterns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pattern implements Persistable<Long>, NewRecordAware {

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

    @Column("pattern_type")
    private String patternType;

    // stage, field or page depending on the type
    @Column("pattern_key")
    private String patternKey;

    private String description;

    private double severity;

    @Column("session_count")
    private int sessionCount;

    @Column("confidence_score")
    private double confidenceScore;

    private PatternMetadata metadata;

    @Column("window_start")
    private LocalDateTime windowStart;

    @Column("window_end")
    private LocalDateTime windowEnd;

    @Column("detected_at")
    private LocalDateTime detectedAt;
}
