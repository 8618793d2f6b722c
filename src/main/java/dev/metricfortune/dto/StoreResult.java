package dev.metricfortune.dto;

import java.util.List;

public record StoreResult(long created, List<String> errors) {

    public static StoreResult empty() {
        return new StoreResult(0, List.of());
    }
}
