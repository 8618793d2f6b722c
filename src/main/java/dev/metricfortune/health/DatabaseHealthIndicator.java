package dev.metricfortune.health;

import io.r2dbc.spi.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs {@code SELECT 1} against PostgreSQL and reports the round trip in {@code responseTimeMs}.
 */
@Component("db")
@RequiredArgsConstructor
@Slf4j
public class DatabaseHealthIndicator implements ReactiveHealthIndicator {

    public static final String RESPONSE_TIME = "responseTimeMs";

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;
    private final ConnectionFactory connectionFactory;

    @Override
    public Mono<Health> health() {
        return Mono.defer(() -> {
                    long started = System.currentTimeMillis();
                    return databaseClient.sql("SELECT 1")
                            .fetch()
                            .one()
                            .map(row -> up(started))
                            .switchIfEmpty(Mono.fromSupplier(() -> up(started)));
                })
                .timeout(TIMEOUT)
                .onErrorResume(this::buildDownHealth);
    }

    private Health up(long started) {
        return Health.up()
                .withDetail("database", connectionFactoryName())
                .withDetail("validationQuery", "SELECT 1")
                .withDetail(RESPONSE_TIME, System.currentTimeMillis() - started)
                .build();
    }

    private String connectionFactoryName() {
        try {
            return connectionFactory.getMetadata().getName();
        } catch (RuntimeException e) {
            log.debug("Connection factory metadata unavailable: {}", e.getMessage());
            return "PostgreSQL";
        }
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Database health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("database", "PostgreSQL")
                .withDetail("error", ex.getClass().getSimpleName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build());
    }
}
