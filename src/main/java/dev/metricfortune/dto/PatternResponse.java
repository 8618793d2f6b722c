package dev.metricfortune.dto;

import dev.metricfortune.entity.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResponse {

    private String id;
    private String patternType;
    private String patternKey;
    private String description;
    private double severity;
    private int sessionCount;
    private double confidenceScore;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private LocalDateTime detectedAt;

    public static PatternResponse from(Pattern pattern) {
        return PatternResponse.builder()
                .id(String.valueOf(pattern.getId()))
                .patternType(pattern.getPatternType())
                .patternKey(pattern.getPatternKey())
                .description(pattern.getDescription())
                .severity(pattern.getSeverity())
                .sessionCount(pattern.getSessionCount())
                .confidenceScore(pattern.getConfidenceScore())
                .windowStart(pattern.getWindowStart())
                .windowEnd(pattern.getWindowEnd())
                .detectedAt(pattern.getDetectedAt())
                .build();
    }
}
