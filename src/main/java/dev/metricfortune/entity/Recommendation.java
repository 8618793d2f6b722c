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

@Table("recommendations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation implements Persistable<Long>, NewRecordAware {

    public static final int MAX_NOTES_LENGTH = 500;

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("business_id")
    private Long businessId;

    @Column("site_id")
    private String siteId;

    // businessId:patternType:subject, see RecommendationEngine
    @Column("recommendation_key")
    private String recommendationKey;

    private String title;

    @Column("problem_statement")
    private String problemStatement;

    @Column("action_steps")
    @Builder.Default
    private String[] actionSteps = new String[0];

    @Column("expected_impact")
    private String expectedImpact;

    @Column("impact_level")
    private String impactLevel;

    @Column("confidence_level")
    private String confidenceLevel;

    // null when no peer implemented it, never an empty string
    @Column("peer_success_data")
    private String peerSuccessData;

    @Builder.Default
    private String status = RecommendationStatus.NEW.name();

    @Column("implementation_notes")
    private String implementationNotes;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("planned_at")
    private LocalDateTime plannedAt;

    @Column("implemented_at")
    private LocalDateTime implementedAt;

    @Column("dismissed_at")
    private LocalDateTime dismissedAt;
}
