package dev.metricfortune.service.tracking;

import dev.metricfortune.config.ResilienceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SiteRateLimiter")
class SiteRateLimiterTest {

    private static final String KEY = "track:site-1";
    private static final String REDIS_KEY = "rate_limit:track:site-1";

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    private final ResilienceConfig resilience = new ResilienceConfig(10, 3, 100, 1000, 5);

    private SiteRateLimiter limiter;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        limiter = new SiteRateLimiter(redisTemplate, resilience, 1000, 60);
    }

    @Test
    @DisplayName("should build tracking keys per site")
    void shouldBuildTrackingKey() {
        assertThat(SiteRateLimiter.trackingKey("abc")).isEqualTo("track:abc");
    }

    @Nested
    @DisplayName("with Redis")
    class WithRedis {

        @Test
        @DisplayName("should open the window on the first request")
        void shouldSetExpiryOnFirstRequest() {
            when(valueOps.increment(REDIS_KEY)).thenReturn(Mono.just(1L));
            when(redisTemplate.expire(REDIS_KEY, Duration.ofSeconds(60))).thenReturn(Mono.just(true));

            StepVerifier.create(limiter.check(KEY))
                    .assertNext(decision -> {
                        assertThat(decision.allowed()).isTrue();
                        assertThat(decision.limit()).isEqualTo(1000);
                        assertThat(decision.remaining()).isEqualTo(999);
                        assertThat(decision.resetAt()).isAfter(Instant.now().plusSeconds(55));
                    })
                    .verifyComplete();

            verify(redisTemplate).expire(REDIS_KEY, Duration.ofSeconds(60));
        }

        @Test
        @DisplayName("should reject the request past the limit and report the remaining window")
        void shouldRejectOverLimit() {
            when(valueOps.increment(REDIS_KEY)).thenReturn(Mono.just(1001L));
            when(redisTemplate.getExpire(REDIS_KEY)).thenReturn(Mono.just(Duration.ofSeconds(20)));

            StepVerifier.create(limiter.check(KEY))
                    .assertNext(decision -> {
                        assertThat(decision.allowed()).isFalse();
                        assertThat(decision.remaining()).isZero();
                        assertThat(decision.resetAt()).isBefore(Instant.now().plusSeconds(21));
                    })
                    .verifyComplete();

            verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("should allow exactly the limit")
        void shouldAllowAtLimit() {
            when(valueOps.increment(REDIS_KEY)).thenReturn(Mono.just(1000L));
            when(redisTemplate.getExpire(REDIS_KEY)).thenReturn(Mono.just(Duration.ofSeconds(5)));

            StepVerifier.create(limiter.check(KEY))
                    .assertNext(decision -> {
                        assertThat(decision.allowed()).isTrue();
                        assertThat(decision.remaining()).isZero();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should restart a window whose counter lost its expiry")
        void shouldReExpireCounterWithoutTtl() {
            when(valueOps.increment(REDIS_KEY)).thenReturn(Mono.just(7L));
            when(redisTemplate.getExpire(REDIS_KEY)).thenReturn(Mono.just(Duration.ofSeconds(-1)));
            when(redisTemplate.expire(REDIS_KEY, Duration.ofSeconds(60))).thenReturn(Mono.just(true));

            StepVerifier.create(limiter.check(KEY))
                    .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                    .verifyComplete();

            verify(redisTemplate).expire(REDIS_KEY, Duration.ofSeconds(60));
        }
    }

    @Nested
    @DisplayName("without Redis")
    class WithoutRedis {

        @Test
        @DisplayName("should fall back to in-memory counting")
        void shouldFallBackToMemory() {
            SiteRateLimiter small = new SiteRateLimiter(redisTemplate, resilience, 2, 60);
            when(valueOps.increment(REDIS_KEY))
                    .thenReturn(Mono.error(new RedisConnectionFailureException("Connection refused")));

            StepVerifier.create(small.check(KEY))
                    .assertNext(decision -> assertThat(decision.remaining()).isEqualTo(1))
                    .verifyComplete();
            StepVerifier.create(small.check(KEY))
                    .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                    .verifyComplete();
            StepVerifier.create(small.check(KEY))
                    .assertNext(decision -> assertThat(decision.allowed()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should count each key separately")
        void shouldSeparateKeys() {
            SiteRateLimiter small = new SiteRateLimiter(redisTemplate, resilience, 1, 60);

            assertThat(small.checkInMemory("track:a").allowed()).isTrue();
            assertThat(small.checkInMemory("track:b").allowed()).isTrue();
            assertThat(small.checkInMemory("track:a").allowed()).isFalse();
        }

        @Test
        @DisplayName("should drop expired windows on cleanup")
        void shouldCleanupExpiredWindows() {
            SiteRateLimiter instant = new SiteRateLimiter(redisTemplate, resilience, 10, 0);
            instant.checkInMemory("track:a");
            assertThat(instant.inMemoryWindowCount()).isEqualTo(1);

            instant.cleanupExpiredWindows();

            assertThat(instant.inMemoryWindowCount()).isZero();
        }
    }
}
