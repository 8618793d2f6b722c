package dev.metricfortune.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Family-specific detail attached to a {@link Pattern}, stored as JSONB.
 * One variant per pattern family; each carries only the fields its family produces.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AbandonmentMetadata.class, name = "abandonment"),
        @JsonSubTypes.Type(value = HesitationMetadata.class, name = "hesitation"),
        @JsonSubTypes.Type(value = EngagementMetadata.class, name = "engagement")
})
public sealed interface PatternMetadata permits AbandonmentMetadata, HesitationMetadata, EngagementMetadata {

    PatternType type();

    /** The stage, field or page the pattern is about. */
    String subject();

    int affectedSessions();

    int sampleSize();

    /** Human-readable one-line summary used as the pattern description. */
    String summary();

    /** Values available to recommendation templates as {@code {{name}}} placeholders. */
    Map<String, Object> templateValues();
}
