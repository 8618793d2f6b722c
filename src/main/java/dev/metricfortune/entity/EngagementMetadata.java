package dev.metricfortune.entity;

import dev.metricfortune.util.Rates;

import java.util.HashMap;
import java.util.Map;

/**
 * A page whose approximate time-on-page falls well below the site average.
 * Times are in seconds; {@code engagementGap} is the shortfall as a percentage of the site average.
 */
public record EngagementMetadata(String page, double timeOnPage, double siteAverage, double engagementGap,
                                 int affectedSessions, int sampleSize) implements PatternMetadata {

    @Override
    public PatternType type() {
        return PatternType.LOW_ENGAGEMENT;
    }

    @Override
    public String subject() {
        return page;
    }

    @Override
    public String summary() {
        return page + " has " + Rates.plain(engagementGap) + "% lower time-on-page than site average ("
                + Rates.plain(timeOnPage) + "s vs " + Rates.plain(siteAverage) + "s, "
                + affectedSessions + " pageviews)";
    }

    @Override
    public Map<String, Object> templateValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("page", page);
        values.put("timeOnPage", timeOnPage);
        values.put("siteAverage", siteAverage);
        values.put("engagementGap", engagementGap);
        values.put("affectedSessions", affectedSessions);
        values.put("sampleSize", sampleSize);
        return values;
    }
}
