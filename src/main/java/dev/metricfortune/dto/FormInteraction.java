package dev.metricfortune.dto;

/**
 * One form event reduced to what hesitation analysis needs.
 *
 * @param sessionId visitor session
 * @param field     field name ({@code data.field}, else {@code data.name}); may be null
 * @param action    {@code focus}, {@code blur} or {@code input}
 */
public record FormInteraction(String sessionId, String field, String action) {

    public boolean isFocus() {
        return "focus".equals(action);
    }
}
