package dev.metricfortune.service.recommendation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemplateInterpolator")
class TemplateInterpolatorTest {

    @Test
    @DisplayName("should round numeric values to whole numbers")
    void shouldRoundNumbers() {
        assertThat(TemplateInterpolator.interpolate("{{rate}}% over {{count}} sessions",
                Map.of("rate", 42.5, "count", 120))).isEqualTo("43% over 120 sessions");
    }

    @Test
    @DisplayName("should render missing values as a marker")
    void shouldMarkMissingValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("field", null);

        assertThat(TemplateInterpolator.interpolate("{{field}} and {{other}}", values))
                .isEqualTo("[data unavailable] and [data unavailable]");
        assertThat(TemplateInterpolator.interpolate("{{field}}", null)).isEqualTo("[data unavailable]");
    }

    @Test
    @DisplayName("should insert strings verbatim, including regex characters")
    void shouldKeepSpecialCharacters() {
        assertThat(TemplateInterpolator.interpolate("Page {{page}}", Map.of("page", "/cart?$total=1\\2")))
                .isEqualTo("Page /cart?$total=1\\2");
    }

    @Test
    @DisplayName("should leave templates without placeholders untouched")
    void shouldPassThrough() {
        assertThat(TemplateInterpolator.interpolate("Simplify payment process", Map.of()))
                .isEqualTo("Simplify payment process");
        assertThat(TemplateInterpolator.interpolate(null, Map.of())).isNull();
    }
}
