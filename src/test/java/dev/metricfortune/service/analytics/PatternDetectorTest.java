package dev.metricfortune.service.analytics;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.AnalysisWindow;
import dev.metricfortune.dto.FormInteraction;
import dev.metricfortune.entity.AbandonmentMetadata;
import dev.metricfortune.entity.EngagementMetadata;
import dev.metricfortune.entity.HesitationMetadata;
import dev.metricfortune.entity.Pattern;
import dev.metricfortune.entity.Session;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.repository.SessionRepository;
import dev.metricfortune.repository.TrackingEventRepository;
import dev.metricfortune.service.IdService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PatternDetector")
class PatternDetectorTest {

    private static final String SITE = "site-1";
    private static final AnalysisWindow WINDOW = new AnalysisWindow(
            LocalDateTime.of(2025, 3, 1, 0, 0), LocalDateTime.of(2025, 3, 8, 0, 0));
    private static final LocalDateTime DETECTED_AT = LocalDateTime.of(2025, 3, 8, 2, 0);

    @Mock private SessionRepository sessionRepository;
    @Mock private TrackingEventRepository trackingEventRepository;
    @Mock private PatternRepository patternRepository;
    @Mock private IdService idService;

    private SimpleMeterRegistry registry;
    private PatternDetector detector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        PipelineMetrics metrics = new PipelineMetrics(registry);
        metrics.init();
        detector = new PatternDetector(sessionRepository, trackingEventRepository, patternRepository, idService,
                new ResilienceConfig(10, 3, 100, 1000, 5), metrics);
        lenient().when(idService.nextId()).thenReturn(1L);
    }

    private static Session session(int duration, String... path) {
        return Session.builder()
                .siteId(SITE)
                .sessionId("s")
                .duration(duration)
                .pageCount(path.length)
                .journeyPath(path)
                .build();
    }

    private static List<Session> sessions(int count, int duration, String... path) {
        return IntStream.range(0, count).mapToObj(i -> session(duration, path)).toList();
    }

    private static List<FormInteraction> focuses(String field, int sessionsCount, int focusesPerSession, int offset) {
        List<FormInteraction> interactions = new ArrayList<>();
        for (int s = 0; s < sessionsCount; s++) {
            for (int f = 0; f < focusesPerSession; f++) {
                interactions.add(new FormInteraction("sess-" + (s + offset), field, "focus"));
            }
            interactions.add(new FormInteraction("sess-" + (s + offset), field, "blur"));
        }
        return interactions;
    }

    @Nested
    @DisplayName("detect")
    class Detect {

        @Test
        @DisplayName("should return no patterns below the minimum session count")
        void shouldSkipSmallSites() {
            when(sessionRepository.findInWindow(SITE, WINDOW.start(), WINDOW.end()))
                    .thenReturn(Flux.fromIterable(sessions(99, 30, "/", "/product")));

            StepVerifier.create(detector.detect(SITE, WINDOW))
                    .assertNext(patterns -> assertThat(patterns).isEmpty())
                    .verifyComplete();

            verifyNoInteractions(trackingEventRepository);
        }

        @Test
        @DisplayName("should keep only patterns backed by at least 100 sessions")
        void shouldFilterBySessionCount() {
            List<Session> all = new ArrayList<>(sessions(100, 60, "/", "/product"));
            all.addAll(sessions(50, 60, "/"));
            // low engagement on /blog, but only 60 pageviews
            all.addAll(sessions(60, 1, "/blog"));
            when(sessionRepository.findInWindow(SITE, WINDOW.start(), WINDOW.end())).thenReturn(Flux.fromIterable(all));
            when(trackingEventRepository.findFormInteractions(SITE, WINDOW.start(), WINDOW.end())).thenReturn(Flux.empty());

            StepVerifier.create(detector.detect(SITE, WINDOW))
                    .assertNext(patterns -> {
                        assertThat(patterns).allMatch(p -> p.getSessionCount() >= 100);
                        assertThat(patterns).extracting(Pattern::getPatternKey).containsExactly("/", "/product");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should still report other patterns when form events cannot be loaded")
        void shouldSurviveHesitationFailure() {
            when(sessionRepository.findInWindow(SITE, WINDOW.start(), WINDOW.end()))
                    .thenReturn(Flux.fromIterable(sessions(120, 60, "/checkout")));
            when(trackingEventRepository.findFormInteractions(SITE, WINDOW.start(), WINDOW.end()))
                    .thenReturn(Flux.error(new IllegalStateException("bad json")));

            StepVerifier.create(detector.detect(SITE, WINDOW))
                    .assertNext(patterns -> assertThat(patterns)
                            .singleElement()
                            .satisfies(p -> assertThat(p.getPatternType()).isEqualTo("ABANDONMENT")))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("detectAbandonment")
    class DetectAbandonment {

        @Test
        @DisplayName("should flag stages where at least 30% of visits end")
        void shouldFlagHighDropOff() {
            List<Session> all = new ArrayList<>(sessions(100, 60, "/", "/product"));
            all.addAll(sessions(50, 60, "/"));

            List<Pattern> patterns = detector.detectAbandonment(SITE, all, WINDOW, DETECTED_AT);

            assertThat(patterns).hasSize(2);
            Pattern home = patterns.get(0);
            AbandonmentMetadata metadata = (AbandonmentMetadata) home.getMetadata();
            assertThat(metadata.stage()).isEqualTo("/");
            assertThat(metadata.dropOffRate()).isEqualTo(33.33);
            assertThat(metadata.affectedSessions()).isEqualTo(50);
            assertThat(home.getSessionCount()).isEqualTo(150);
            assertThat(home.getConfidenceScore()).isEqualTo(0.6);
            assertThat(home.getDescription()).isEqualTo("33.33% of users abandon at / (50 sessions)");

            Pattern product = patterns.get(1);
            // 1.0 * 0.7 + 100 / 150 * 0.3
            assertThat(product.getSeverity()).isCloseTo(0.9, within(1e-9));
            assertThat(product.getWindowStart()).isEqualTo(WINDOW.start());
            assertThat(product.getDetectedAt()).isEqualTo(DETECTED_AT);
        }

        @Test
        @DisplayName("should ignore stages below the abandonment rate")
        void shouldIgnoreLowDropOff() {
            List<Session> all = new ArrayList<>(sessions(80, 60, "/", "/product", "/cart"));
            all.addAll(sessions(20, 60, "/"));

            List<Pattern> patterns = detector.detectAbandonment(SITE, all, WINDOW, DETECTED_AT);

            assertThat(patterns).extracting(Pattern::getPatternKey).doesNotContain("/");
        }
    }

    @Nested
    @DisplayName("hesitationPatterns")
    class HesitationPatterns {

        @Test
        @DisplayName("should flag fields re-focused by at least 20% of sessions")
        void shouldFlagReEntries() {
            List<FormInteraction> interactions = new ArrayList<>(focuses("email", 25, 3, 0));
            interactions.addAll(focuses("email", 75, 1, 25));

            List<Pattern> patterns = detector.hesitationPatterns(SITE, interactions, WINDOW, DETECTED_AT);

            assertThat(patterns).singleElement().satisfies(p -> {
                HesitationMetadata metadata = (HesitationMetadata) p.getMetadata();
                assertThat(metadata.field()).isEqualTo("email");
                assertThat(metadata.reEntryRate()).isEqualTo(25.0);
                assertThat(metadata.avgReEntries()).isEqualTo(3.0);
                assertThat(metadata.affectedSessions()).isEqualTo(25);
                assertThat(p.getSessionCount()).isEqualTo(100);
                assertThat(p.getDescription()).isEqualTo("25% of users re-enter \"email\" field (hesitation indicator, 25 sessions)");
            });
        }

        @Test
        @DisplayName("should ignore fields below the hesitation rate and blank field names")
        void shouldIgnoreQuietFields() {
            List<FormInteraction> interactions = new ArrayList<>(focuses("phone", 19, 2, 0));
            interactions.addAll(focuses("phone", 81, 1, 19));
            interactions.addAll(focuses(" ", 150, 4, 0));

            assertThat(detector.hesitationPatterns(SITE, interactions, WINDOW, DETECTED_AT)).isEmpty();
        }
    }

    @Nested
    @DisplayName("detectLowEngagement")
    class DetectLowEngagement {

        @Test
        @DisplayName("should flag pages under 70% of the site average time-on-page")
        void shouldFlagShortVisits() {
            List<Session> all = new ArrayList<>(sessions(60, 10, "/category/shoes"));
            all.addAll(sessions(60, 100, "/product/boot"));
            all.add(Session.builder().siteId(SITE).duration(null).pageCount(1).journeyPath(new String[]{"/open"}).build());

            List<Pattern> patterns = detector.detectLowEngagement(SITE, all, WINDOW, DETECTED_AT);

            assertThat(patterns).singleElement().satisfies(p -> {
                EngagementMetadata metadata = (EngagementMetadata) p.getMetadata();
                assertThat(metadata.page()).isEqualTo("/category/shoes");
                assertThat(metadata.timeOnPage()).isEqualTo(10.0);
                assertThat(metadata.siteAverage()).isEqualTo(55.0);
                assertThat(metadata.engagementGap()).isEqualTo(81.82);
                assertThat(p.getSessionCount()).isEqualTo(60);
            });
        }

        @Test
        @DisplayName("should skip pages with fewer than 50 pageviews")
        void shouldSkipRarePages() {
            List<Session> all = new ArrayList<>(sessions(49, 1, "/rare"));
            all.addAll(sessions(60, 100, "/product/boot"));

            assertThat(detector.detectLowEngagement(SITE, all, WINDOW, DETECTED_AT)).isEmpty();
        }
    }

    @Nested
    @DisplayName("store")
    class Store {

        private Pattern pattern(String key) {
            return Pattern.builder().siteId(SITE).patternType("ABANDONMENT").patternKey(key).build();
        }

        @Test
        @DisplayName("should bulk insert and count created rows")
        void shouldBulkInsert() {
            when(patternRepository.insertAllSkipDuplicates(anyList())).thenReturn(Mono.just(2L));

            StepVerifier.create(detector.store(List.of(pattern("/a"), pattern("/b"))))
                    .assertNext(result -> {
                        assertThat(result.created()).isEqualTo(2);
                        assertThat(result.errors()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(registry.counter("insights.patterns.stored").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should fall back to one insert per pattern and collect the failures")
        void shouldFallBackPerRecord() {
            Pattern a = pattern("/a");
            Pattern b = pattern("/b");
            when(patternRepository.insertAllSkipDuplicates(List.of(a, b)))
                    .thenReturn(Mono.error(new IllegalStateException("value too long")));
            when(patternRepository.insertAllSkipDuplicates(List.of(a))).thenReturn(Mono.just(1L));
            when(patternRepository.insertAllSkipDuplicates(List.of(b)))
                    .thenReturn(Mono.error(new IllegalStateException("value too long")));

            StepVerifier.create(detector.store(List.of(a, b)))
                    .assertNext(result -> {
                        assertThat(result.created()).isEqualTo(1);
                        assertThat(result.errors()).hasSize(2);
                        assertThat(result.errors().get(0)).startsWith("Bulk insert failed");
                        assertThat(result.errors().get(1)).contains("/b");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not touch the store for an empty list")
        void shouldSkipEmpty() {
            StepVerifier.create(detector.store(List.of()))
                    .assertNext(result -> assertThat(result.created()).isZero())
                    .verifyComplete();

            verifyNoInteractions(patternRepository);
        }
    }
}
