package dev.metricfortune.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Batch posted by the storefront tracking script to {@code POST /api/track}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackRequest {

    @NotEmpty(message = "At least one event is required")
    @Size(max = 500, message = "At most 500 events per batch")
    private List<@Valid TrackedEvent> events;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrackedEvent {

        @NotBlank(message = "siteId is required")
        @Size(max = 64, message = "siteId must be at most 64 characters")
        private String siteId;

        @NotBlank(message = "sessionId is required")
        @Size(max = 128, message = "sessionId must be at most 128 characters")
        private String sessionId;

        @NotNull(message = "event is required")
        @Valid
        private EventPayload event;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventPayload {

        @NotNull(message = "type is required")
        @Pattern(regexp = "^(pageview|click|form|scroll|time)$",
                message = "type must be one of pageview, click, form, scroll, time")
        private String type;

        @NotNull(message = "timestamp is required")
        @Positive(message = "timestamp must be positive")
        private Long timestamp;

        // open payload: url, field, action, scroll depth...
        private Map<String, Object> data;
    }
}
