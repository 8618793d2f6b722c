package dev.metricfortune.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Event types accepted by the tracking endpoint. Stored lower-case, as sent by the client script.
 */
public enum EventType {
    PAGEVIEW,
    CLICK,
    FORM,
    SCROLL,
    TIME;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean matches(String type) {
        return wireName().equals(type);
    }

    public static Optional<EventType> fromWire(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.matches(type)).findFirst();
    }
}
