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
 * Snapshot of a matching run: the criteria used, the tier that produced enough peers,
 * and the member ids (the business itself first).
 */
@Table("peer_groups")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeerGroup implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String tier;

    private String industry;

    @Column("revenue_range")
    private String revenueRange;

    private String platform;

    @Column("product_types")
    @Builder.Default
    private String[] productTypes = new String[0];

    @Column("business_ids")
    @Builder.Default
    private Long[] businessIds = new Long[0];

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
