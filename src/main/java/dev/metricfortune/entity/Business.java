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
 * Store profile. Created by the profile screens elsewhere; this service only reads it
 * and maintains {@code peerGroupId}.
 */
@Table("businesses")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Business implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    // owning account
    @Column("user_id")
    private String userId;

    private String name;

    private String industry;

    // one of RevenueRanges.TIERS, e.g. "$1M-5M"
    @Column("revenue_range")
    private String revenueRange;

    @Column("product_types")
    @Builder.Default
    private String[] productTypes = new String[0];

    private String platform;

    @Column("site_id")
    private String siteId;

    @Column("peer_group_id")
    private Long peerGroupId;

    @Column("created_at")
    private LocalDateTime createdAt;
}
