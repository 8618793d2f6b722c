package dev.metricfortune.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Journey funnel for one site: Entry, Product View, Cart, Checkout, Purchase.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FunnelReport {
    private List<Stage> stages;
    private int totalSessions;
    private double overallConversion;
    private String journeyType;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    // sessions whose path reaches position i (0-based)
    private List<Integer> positionReach;
    private List<JourneyTypeStats> journeyTypes;
    private Insight insight;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Stage {
        private String name;
        private int count;
        private double percentage;
        // null for the first stage
        private Double dropOffRate;
        // null for the last stage
        private Double conversionRate;
        private Long avgTimeSpent;
        private List<StagePage> topPages;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StagePage {
        private String url;
        private int count;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JourneyTypeStats {
        private String type;
        private String label;
        private int count;
        private double percentage;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Insight {
        private String primary;
        private String secondary;
        private String biggestDropOffStage;
        private Double biggestDropOffRate;
        private String bestPerformingStage;
        private Double bestConversionRate;
    }
}
