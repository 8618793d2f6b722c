package dev.metricfortune.service.recommendation;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{name}}} placeholders from pattern metadata. Numbers are rounded to whole values;
 * a missing value renders as {@value #MISSING}.
 */
public final class TemplateInterpolator {

    static final String MISSING = "[data unavailable]";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private TemplateInterpolator() {
    }

    public static String interpolate(String template, Map<String, Object> values) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = values != null ? values.get(matcher.group(1)) : null;
            matcher.appendReplacement(result, Matcher.quoteReplacement(format(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String format(Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Number number) {
            return String.valueOf(Math.round(number.doubleValue()));
        }
        return value.toString();
    }
}
