package dev.metricfortune.entity;

import dev.metricfortune.util.Rates;

import java.util.HashMap;
import java.util.Map;

/**
 * Repeated focus on one form field.
 *
 * @param field            form field name
 * @param reEntryRate      percentage of interacting sessions that focused the field more than once
 * @param avgReEntries     mean focus count among re-entering sessions
 * @param affectedSessions sessions with a re-entry
 * @param sampleSize       sessions that interacted with the field
 */
public record HesitationMetadata(String field, double reEntryRate, double avgReEntries,
                                 int affectedSessions, int sampleSize) implements PatternMetadata {

    @Override
    public PatternType type() {
        return PatternType.HESITATION;
    }

    @Override
    public String subject() {
        return field;
    }

    @Override
    public String summary() {
        return Rates.plain(reEntryRate) + "% of users re-enter \"" + field
                + "\" field (hesitation indicator, " + affectedSessions + " sessions)";
    }

    @Override
    public Map<String, Object> templateValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("field", field);
        values.put("reEntryRate", reEntryRate);
        values.put("avgReEntries", avgReEntries);
        values.put("affectedSessions", affectedSessions);
        values.put("sampleSize", sampleSize);
        return values;
    }
}
