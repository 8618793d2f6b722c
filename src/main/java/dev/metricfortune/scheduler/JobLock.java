package dev.metricfortune.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis SETNX lock keeping a job to one instance at a time. When Redis is unreachable the job
 * runs anyway: a duplicate run is idempotent, a skipped one is not recoverable until the next schedule.
 *
 * <p>The lock value is a per-run token and release only deletes the key while it still holds
 * that token, so a run that outlived its TTL cannot drop another instance's lock.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobLock {

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;

    /**
     * Runs {@code work} while holding {@code key}. Completes empty when another instance holds it.
     */
    public <T> Mono<T> withLock(String key, Duration ttl, Supplier<Mono<T>> work) {
        String token = UUID.randomUUID().toString();
        return redisTemplate.opsForValue().setIfAbsent(key, token, ttl)
                .onErrorResume(e -> {
                    log.debug("Redis unavailable for job lock {}, proceeding without lock: {}", key, e.getMessage());
                    return Mono.just(true);
                })
                .flatMap(acquired -> {
                    if (!Boolean.TRUE.equals(acquired)) {
                        log.info("Skipping run, another instance holds {}", key);
                        return Mono.empty();
                    }
                    return Mono.defer(work)
                            .doFinally(signal -> release(key, token));
                });
    }

    private void release(String key, String token) {
        redisTemplate.execute(RELEASE_SCRIPT, List.of(key), List.of(token))
                .next()
                .subscribe(
                        released -> {
                            if (released == 0L) {
                                log.warn("Lock {} expired before the run finished and is now held elsewhere", key);
                            }
                        },
                        e -> log.debug("Could not release job lock {}: {}", key, e.getMessage()));
    }
}
