package dev.metricfortune.dto;

import dev.metricfortune.entity.Recommendation;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImplementRecommendationRequest {

    @NotNull(message = "Implementation date is required")
    @PastOrPresent(message = "Implementation date cannot be in the future")
    private LocalDateTime implementedAt;

    @Size(max = Recommendation.MAX_NOTES_LENGTH, message = "Notes must be at most 500 characters")
    private String notes;
}
