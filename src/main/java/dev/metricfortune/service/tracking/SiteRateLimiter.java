package dev.metricfortune.service.tracking;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window request quota per site ({@code track:<siteId>}, 1000 per minute by default).
 * Counters live in Redis ({@code INCR} + {@code EXPIRE}) so every instance shares the window;
 * while Redis is unreachable each instance counts in memory instead.
 * Over-limit requests are rejected, never queued.
 */
@Component
@Slf4j
public class SiteRateLimiter {

    private static final String KEY_PREFIX = "rate_limit:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ResilienceConfig resilience;
    private final int limit;
    private final Duration window;

    private record WindowEntry(AtomicLong count, Instant resetAt) {}
    private final ConcurrentHashMap<String, WindowEntry> inMemoryWindows = new ConcurrentHashMap<>();

    public SiteRateLimiter(ReactiveStringRedisTemplate redisTemplate,
                           ResilienceConfig resilience,
                           @Value("${tracking.rate-limit.limit:1000}") int limit,
                           @Value("${tracking.rate-limit.window-seconds:60}") int windowSeconds) {
        this.redisTemplate = redisTemplate;
        this.resilience = resilience;
        this.limit = limit;
        this.window = Duration.ofSeconds(windowSeconds);
    }

    public static String trackingKey(String siteId) {
        return "track:" + siteId;
    }

    /**
     * Counts one request against {@code key} and reports whether it fits the current window.
     */
    public Mono<RateLimitDecision> check(String key) {
        String redisKey = KEY_PREFIX + key;
        return redisTemplate.opsForValue().increment(redisKey)
                .flatMap(count -> resetTime(redisKey, count)
                        .map(resetAt -> RateLimitDecision.of(count, limit, resetAt)))
                .timeout(resilience.getRedisTimeout())
                .onErrorResume(e -> {
                    log.warn("Rate limiting Redis unavailable ({}), using in-memory fallback: {}",
                            e.getClass().getSimpleName(), e.getMessage());
                    return Mono.just(checkInMemory(key));
                })
                .doOnNext(decision -> {
                    if (!decision.allowed()) {
                        log.warn("Rate limit exceeded for {}: limit {}", key, limit);
                    }
                });
    }

    private Mono<Instant> resetTime(String redisKey, long count) {
        if (count == 1) {
            return redisTemplate.expire(redisKey, window).thenReturn(Instant.now().plus(window));
        }
        return redisTemplate.getExpire(redisKey)
                .flatMap(ttl -> {
                    if (ttl.isNegative() || ttl.isZero()) {
                        // counter without TTL (expire lost after INCR): start a fresh window
                        return redisTemplate.expire(redisKey, window).thenReturn(Instant.now().plus(window));
                    }
                    return Mono.just(Instant.now().plus(ttl));
                })
                .defaultIfEmpty(Instant.now().plus(window));
    }

    RateLimitDecision checkInMemory(String key) {
        Instant now = Instant.now();
        WindowEntry entry = inMemoryWindows.compute(key, (k, existing) -> {
            if (existing == null || !existing.resetAt().isAfter(now)) {
                return new WindowEntry(new AtomicLong(1), now.plus(window));
            }
            existing.count().incrementAndGet();
            return existing;
        });
        return RateLimitDecision.of(entry.count().get(), limit, entry.resetAt());
    }

    /**
     * Drops expired in-memory windows every 5 minutes.
     */
    @Scheduled(fixedRate = 300000)
    public void cleanupExpiredWindows() {
        Instant now = Instant.now();
        inMemoryWindows.entrySet().removeIf(entry -> !entry.getValue().resetAt().isAfter(now));
    }

    int inMemoryWindowCount() {
        return inMemoryWindows.size();
    }
}
