package dev.metricfortune.entity;

import dev.metricfortune.util.Rates;

import java.util.HashMap;
import java.util.Map;

/**
 * Drop-off at one journey stage.
 *
 * @param stage            page identifier where sessions stopped
 * @param dropOffRate      percentage of sessions at the stage that went no further
 * @param affectedSessions sessions that stopped at the stage
 * @param sampleSize       sessions that reached the stage
 */
public record AbandonmentMetadata(String stage, double dropOffRate, int affectedSessions, int sampleSize)
        implements PatternMetadata {

    @Override
    public PatternType type() {
        return PatternType.ABANDONMENT;
    }

    @Override
    public String subject() {
        return stage;
    }

    @Override
    public String summary() {
        return Rates.plain(dropOffRate) + "% of users abandon at " + stage + " (" + affectedSessions + " sessions)";
    }

    @Override
    public Map<String, Object> templateValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("stage", stage);
        values.put("dropOffRate", dropOffRate);
        values.put("affectedSessions", affectedSessions);
        values.put("sampleSize", sampleSize);
        return values;
    }
}
