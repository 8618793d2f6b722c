package dev.metricfortune.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.metricfortune.entity.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResponse {

    private String id;
    private String businessId;
    private String title;
    private String problemStatement;
    private List<String> actionSteps;
    private String expectedImpact;
    private String impactLevel;
    private String confidenceLevel;
    private String peerSuccessData;
    private String status;
    private String implementationNotes;
    private LocalDateTime createdAt;
    private LocalDateTime plannedAt;
    private LocalDateTime implementedAt;
    private LocalDateTime dismissedAt;

    // ids are serialized as strings, JavaScript clients lose precision on 64-bit longs
    public static RecommendationResponse from(Recommendation recommendation) {
        return RecommendationResponse.builder()
                .id(String.valueOf(recommendation.getId()))
                .businessId(String.valueOf(recommendation.getBusinessId()))
                .title(recommendation.getTitle())
                .problemStatement(recommendation.getProblemStatement())
                .actionSteps(recommendation.getActionSteps() != null
                        ? List.of(recommendation.getActionSteps())
                        : List.of())
                .expectedImpact(recommendation.getExpectedImpact())
                .impactLevel(recommendation.getImpactLevel())
                .confidenceLevel(recommendation.getConfidenceLevel())
                .peerSuccessData(recommendation.getPeerSuccessData())
                .status(recommendation.getStatus())
                .implementationNotes(recommendation.getImplementationNotes())
                .createdAt(recommendation.getCreatedAt())
                .plannedAt(recommendation.getPlannedAt())
                .implementedAt(recommendation.getImplementedAt())
                .dismissedAt(recommendation.getDismissedAt())
                .build();
    }
}
