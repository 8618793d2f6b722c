package dev.metricfortune.service.analytics;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Visitor journeys classified by entry page.
 */
public enum JourneyType {
    ALL("all", "All Visitors"),
    HOMEPAGE("homepage", "Homepage Visitors"),
    SEARCH("search", "Search Visitors"),
    DIRECT_TO_PRODUCT("direct-to-product", "Direct-to-Product Visitors"),
    OTHER("other", "Other Visitors");

    private final String wireName;
    private final String label;

    JourneyType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public static Optional<JourneyType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.wireName.equals(normalized)).findFirst();
    }
}
