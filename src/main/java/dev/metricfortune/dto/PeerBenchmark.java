package dev.metricfortune.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * How a business compares with its peer group. {@code status} is {@code ok} when comparisons are
 * present; otherwise it says why not and {@code message} explains it to the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeerBenchmark {

    public static final String OK = "ok";
    public static final String PENDING = "pending";
    public static final String INSUFFICIENT_PEERS = "insufficient_peers";
    public static final String INSUFFICIENT_SESSIONS = "insufficient_sessions";

    private String status;
    private String message;
    private Group peerGroup;
    private List<Comparison> comparisons;

    public static PeerBenchmark insufficientData(String status, String message, Group group) {
        return PeerBenchmark.builder()
                .status(status)
                .message(message)
                .peerGroup(group)
                .comparisons(List.of())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Group {
        private Long id;
        private String tier;
        private int businessCount;
        private String industry;
        private String revenueRange;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Comparison {
        private String metric;
        private String label;
        private double value;
        private double peerAverage;
        // above / at / below the peer average
        private String performance;
        private String percentile;
        private int percentileValue;
        private String explanation;
    }
}
