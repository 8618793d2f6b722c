package dev.metricfortune.service;

import dev.metricfortune.util.SnowflakeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IdServiceTest {

    private final IdService idService = new IdService(new SnowflakeId(3));

    @Test
    @DisplayName("should hand out distinct increasing ids")
    void shouldHandOutIncreasingIds() {
        long first = idService.nextId();
        long second = idService.nextId();

        assertThat(second).isGreaterThan(first);
        assertThat(SnowflakeId.nodeOf(second)).isEqualTo(3);
    }

    @Test
    @DisplayName("should recover the creation instant from an id")
    void shouldRecoverCreationInstant() {
        Instant before = Instant.now().minusMillis(1);
        long id = idService.nextId();

        assertThat(idService.createdAt(id)).isBetween(before, Instant.now().plus(Duration.ofMillis(10)));
    }
}
