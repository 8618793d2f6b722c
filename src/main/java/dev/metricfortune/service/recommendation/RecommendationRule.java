package dev.metricfortune.service.recommendation;

import dev.metricfortune.entity.PatternMetadata;
import dev.metricfortune.entity.PatternType;

import java.util.List;
import java.util.function.Predicate;

/**
 * One (predicate, template) pair. Templates may reference any key of
 * {@link PatternMetadata#templateValues()}.
 */
public record RecommendationRule(
        PatternType patternType,
        Predicate<PatternMetadata> matcher,
        String titleTemplate,
        String problemTemplate,
        List<String> actionSteps,
        String expectedImpactTemplate,
        ConversionWeight conversionWeight
) {

    public boolean matches(PatternMetadata metadata) {
        return metadata.type() == patternType && matcher.test(metadata);
    }

    public String title(PatternMetadata metadata) {
        return TemplateInterpolator.interpolate(titleTemplate, metadata.templateValues());
    }

    public String problem(PatternMetadata metadata) {
        return TemplateInterpolator.interpolate(problemTemplate, metadata.templateValues());
    }

    public String expectedImpact(PatternMetadata metadata) {
        return TemplateInterpolator.interpolate(expectedImpactTemplate, metadata.templateValues());
    }
}
