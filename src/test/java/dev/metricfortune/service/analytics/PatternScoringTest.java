package dev.metricfortune.service.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PatternScoring")
class PatternScoringTest {

    @Test
    @DisplayName("should weight rate at 0.7 and volume at 0.3")
    void shouldWeightRateAndVolume() {
        assertThat(PatternScoring.severity(0.5, 50, 100)).isCloseTo(0.5, within(1e-9));
        assertThat(PatternScoring.severity(0.4, 100, 400)).isCloseTo(0.355, within(1e-9));
    }

    @Test
    @DisplayName("should clamp severity to [0, 1]")
    void shouldClampSeverity() {
        assertThat(PatternScoring.severity(2.0, 300, 100)).isEqualTo(1.0);
        assertThat(PatternScoring.severity(-1.0, 0, 100)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("should ignore volume when nothing was analyzed")
    void shouldHandleZeroTotal() {
        assertThat(PatternScoring.severity(0.5, 10, 0)).isCloseTo(0.35, within(1e-9));
    }

    @ParameterizedTest(name = "{0} sessions -> {1}")
    @CsvSource({"0, 0.0", "99, 0.0", "100, 0.6", "199, 0.6", "200, 0.8", "499, 0.8", "500, 1.0", "10000, 1.0"})
    @DisplayName("should step confidence by sample size")
    void shouldStepConfidence(long sampleSize, double expected) {
        assertThat(PatternScoring.confidence(sampleSize)).isEqualTo(expected);
    }
}
