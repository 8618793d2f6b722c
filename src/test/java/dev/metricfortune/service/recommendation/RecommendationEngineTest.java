package dev.metricfortune.service.recommendation;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.dto.GenerationRequest;
import dev.metricfortune.entity.AbandonmentMetadata;
import dev.metricfortune.entity.EngagementMetadata;
import dev.metricfortune.entity.HesitationMetadata;
import dev.metricfortune.entity.Pattern;
import dev.metricfortune.entity.PatternMetadata;
import dev.metricfortune.entity.Recommendation;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.PatternRepository;
import dev.metricfortune.repository.RecommendationRepository;
import dev.metricfortune.service.IdService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationEngine")
class RecommendationEngineTest {

    private static final Long BUSINESS_ID = 7L;
    private static final String SITE = "site-7";
    private static final LocalDateTime DETECTED = LocalDateTime.of(2025, 3, 8, 2, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-08T12:00:00Z"), ZoneOffset.UTC);

    @Mock private PatternRepository patternRepository;
    @Mock private RecommendationRepository recommendationRepository;
    @Mock private PeerSuccessService peerSuccessService;
    @Mock private IdService idService;

    private SimpleMeterRegistry registry;
    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        PipelineMetrics metrics = new PipelineMetrics(registry);
        metrics.init();
        engine = new RecommendationEngine(patternRepository, recommendationRepository, peerSuccessService, idService,
                new ResilienceConfig(10, 3, 100, 1000, 5), metrics, CLOCK, 7, 0.3, 5, true);

        lenient().when(idService.nextId()).thenReturn(100L, 101L, 102L, 103L, 104L, 105L);
        lenient().when(recommendationRepository.findOpenRecommendationKeys(anyLong())).thenReturn(Flux.empty());
        lenient().when(recommendationRepository.save(any(Recommendation.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(peerSuccessService.peerSuccess(anyLong(), anyString())).thenReturn(Mono.empty());
    }

    private static Pattern pattern(PatternMetadata metadata, double severity, double confidence, LocalDateTime detectedAt) {
        return Pattern.builder()
                .id(1L)
                .siteId(SITE)
                .patternType(metadata.type().name())
                .patternKey(metadata.subject())
                .severity(severity)
                .confidenceScore(confidence)
                .sessionCount(metadata.sampleSize())
                .metadata(metadata)
                .detectedAt(detectedAt)
                .build();
    }

    private static Pattern shippingAbandonment(double severity) {
        return pattern(new AbandonmentMetadata("/checkout/shipping", 42.5, 85, 200), severity, 0.8, DETECTED);
    }

    private static Pattern emailHesitation(double severity) {
        return pattern(new HesitationMetadata("email", 25.0, 2.4, 30, 120), severity, 0.6, DETECTED);
    }

    private static Pattern categoryEngagement(double severity) {
        return pattern(new EngagementMetadata("/category/boots", 12.0, 40.0, 70.0, 150, 150), severity, 0.6, DETECTED);
    }

    private static Pattern stageAbandonment(int stage, double severity) {
        return pattern(new AbandonmentMetadata("/stage" + stage, 40.0, 80, 200), severity, 0.8, DETECTED);
    }

    private void givenOpenKeys(String... keys) {
        when(recommendationRepository.findOpenRecommendationKeys(BUSINESS_ID)).thenReturn(Flux.just(keys));
    }

    private void givenPatterns(Pattern... patterns) {
        when(patternRepository.findSignificantSince(eq(SITE), any(LocalDateTime.class), eq(0.3)))
                .thenReturn(Flux.just(patterns));
    }

    private List<Recommendation> savedRecommendations(int times) {
        ArgumentCaptor<Recommendation> captor = ArgumentCaptor.forClass(Recommendation.class);
        verify(recommendationRepository, times(times)).save(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("should store recommendations ordered by severity times conversion weight")
        void shouldRankByImpactScore() {
            // impact scores: 0.5 * 3.0 = 1.5, 0.8 * 2.0 = 1.6, 0.9 * 1.5 = 1.35
            givenPatterns(shippingAbandonment(0.5), emailHesitation(0.8), categoryEngagement(0.9));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.patternsProcessed()).isEqualTo(3);
                        assertThat(result.generated()).isEqualTo(3);
                        assertThat(result.stored()).isEqualTo(3);
                        assertThat(result.skipped()).isZero();
                        assertThat(result.errors()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(savedRecommendations(3)).extracting(Recommendation::getTitle).containsExactly(
                    "Optimize email input experience",
                    "Show shipping costs earlier in checkout",
                    "Improve category browsing experience");
            assertThat(registry.counter("insights.recommendations.created").count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should fill templates and derive levels from the pattern")
        void shouldBuildRecommendationFromPattern() {
            givenPatterns(shippingAbandonment(0.75));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .expectNextCount(1)
                    .verifyComplete();

            Recommendation saved = savedRecommendations(1).get(0);
            assertThat(saved.getBusinessId()).isEqualTo(BUSINESS_ID);
            assertThat(saved.getSiteId()).isEqualTo(SITE);
            assertThat(saved.getRecommendationKey()).isEqualTo("7:ABANDONMENT:/checkout/shipping");
            assertThat(saved.getProblemStatement()).isEqualTo("43% of customers abandon during shipping step");
            assertThat(saved.getActionSteps()).hasSize(3);
            assertThat(saved.getExpectedImpact()).isEqualTo("Reduce shipping page abandonment by 15-25%");
            assertThat(saved.getImpactLevel()).isEqualTo("HIGH");
            assertThat(saved.getConfidenceLevel()).isEqualTo("MEDIUM");
            assertThat(saved.getStatus()).isEqualTo("NEW");
            assertThat(saved.getPeerSuccessData()).isNull();
        }

        @Test
        @DisplayName("should keep only the highest scoring candidate per key")
        void shouldDeduplicateByKey() {
            givenPatterns(emailHesitation(0.3), emailHesitation(0.6), shippingAbandonment(0.3));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.patternsProcessed()).isEqualTo(3);
                        assertThat(result.generated()).isEqualTo(2);
                    })
                    .verifyComplete();

            List<Recommendation> saved = savedRecommendations(2);
            assertThat(saved.get(0).getRecommendationKey()).isEqualTo("7:HESITATION:email");
            assertThat(saved.get(0).getImpactLevel()).isEqualTo("MEDIUM");
        }

        @Test
        @DisplayName("should truncate to the requested maximum after deduplication")
        void shouldTruncate() {
            givenPatterns(shippingAbandonment(0.5), emailHesitation(0.8), categoryEngagement(0.9));

            StepVerifier.create(engine.generate(GenerationRequest.builder()
                            .businessId(BUSINESS_ID).siteId(SITE).maxRecommendations(1).build()))
                    .assertNext(result -> assertThat(result.generated()).isEqualTo(1))
                    .verifyComplete();

            assertThat(savedRecommendations(1).get(0).getTitle()).isEqualTo("Optimize email input experience");
        }

        @Test
        @DisplayName("should skip keys that already have an open recommendation")
        void shouldSkipOpenDuplicates() {
            givenPatterns(shippingAbandonment(0.5), emailHesitation(0.8), emailHesitation(0.4));
            givenOpenKeys("7:HESITATION:email");

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.generated()).isEqualTo(1);
                        assertThat(result.stored()).isEqualTo(1);
                        assertThat(result.skipped()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(savedRecommendations(1).get(0).getRecommendationKey())
                    .isEqualTo("7:ABANDONMENT:/checkout/shipping");
        }

        @Test
        @DisplayName("should not let open keys take slots from lower ranked new patterns")
        void shouldDropOpenKeysBeforeTruncation() {
            givenPatterns(IntStream.range(0, 6)
                    .mapToObj(stage -> stageAbandonment(stage, 0.9 - stage * 0.1))
                    .toArray(Pattern[]::new));
            givenOpenKeys("7:ABANDONMENT:/stage0", "7:ABANDONMENT:/stage1", "7:ABANDONMENT:/stage2",
                    "7:ABANDONMENT:/stage3", "7:ABANDONMENT:/stage4");

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.patternsProcessed()).isEqualTo(6);
                        assertThat(result.generated()).isEqualTo(1);
                        assertThat(result.stored()).isEqualTo(1);
                        assertThat(result.skipped()).isEqualTo(5);
                        assertThat(result.errors()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(savedRecommendations(1).get(0).getRecommendationKey()).isEqualTo("7:ABANDONMENT:/stage5");
        }

        @Test
        @DisplayName("should read the analysis window and creation time from the clock")
        void shouldUseClock() {
            givenPatterns(shippingAbandonment(0.5));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(patternRepository).findSignificantSince(SITE, LocalDateTime.of(2025, 3, 1, 12, 0), 0.3);
            assertThat(savedRecommendations(1).get(0).getCreatedAt()).isEqualTo(LocalDateTime.of(2025, 3, 8, 12, 0));
        }

        @Test
        @DisplayName("should return an error result when open recommendations cannot be loaded")
        void shouldReportOpenKeyLoadFailure() {
            givenPatterns(shippingAbandonment(0.5));
            when(recommendationRepository.findOpenRecommendationKeys(BUSINESS_ID))
                    .thenReturn(Flux.error(new IllegalStateException("permission denied for table recommendations")));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.stored()).isZero();
                        assertThat(result.errors()).containsExactly("permission denied for table recommendations");
                    })
                    .verifyComplete();

            verify(recommendationRepository, never()).save(any());
        }

        @Test
        @DisplayName("should count a lost insert race as skipped")
        void shouldTreatUniqueViolationAsSkipped() {
            givenPatterns(shippingAbandonment(0.5));
            doReturn(Mono.error(new DataIntegrityViolationException("duplicate key")))
                    .when(recommendationRepository).save(any(Recommendation.class));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.stored()).isZero();
                        assertThat(result.skipped()).isEqualTo(1);
                        assertThat(result.errors()).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report other store failures without stopping the run")
        void shouldCollectStoreErrors() {
            givenPatterns(shippingAbandonment(0.5), emailHesitation(0.8));
            doReturn(Mono.error(new IllegalStateException("disk full")))
                    .doAnswer(inv -> Mono.just(inv.getArgument(0)))
                    .when(recommendationRepository).save(any(Recommendation.class));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.stored()).isEqualTo(1);
                        assertThat(result.errors()).singleElement()
                                .isEqualTo("Failed to store 7:HESITATION:email: disk full");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should attach peer evidence when peers implemented a similar recommendation")
        void shouldAttachPeerData() {
            givenPatterns(shippingAbandonment(0.5));
            when(peerSuccessService.peerSuccess(BUSINESS_ID, "Show shipping costs earlier in checkout"))
                    .thenReturn(Mono.just(new PeerSuccessStats(12, 3, 0.75, 18)));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(savedRecommendations(1).get(0).getPeerSuccessData())
                    .isEqualTo("3 similar stores implemented this and saw 18% average improvement");
        }

        @Test
        @DisplayName("should not look up peers when peer data is disabled")
        void shouldSkipPeerLookup() {
            givenPatterns(shippingAbandonment(0.5));

            StepVerifier.create(engine.generate(GenerationRequest.builder()
                            .businessId(BUSINESS_ID).siteId(SITE).includePeerData(false).build()))
                    .expectNextCount(1)
                    .verifyComplete();

            verifyNoInteractions(peerSuccessService);
        }

        @Test
        @DisplayName("should skip patterns without metadata")
        void shouldSkipPatternsWithoutMetadata() {
            Pattern broken = Pattern.builder().id(9L).siteId(SITE).patternType("ABANDONMENT").patternKey("/x")
                    .severity(0.9).build();
            givenPatterns(broken);

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.patternsProcessed()).isEqualTo(1);
                        assertThat(result.generated()).isZero();
                    })
                    .verifyComplete();

            verify(recommendationRepository, never()).save(any());
        }

        @Test
        @DisplayName("should return an error result when patterns cannot be loaded")
        void shouldReportLoadFailure() {
            when(patternRepository.findSignificantSince(eq(SITE), any(LocalDateTime.class), anyDouble()))
                    .thenReturn(Flux.error(new IllegalStateException("relation does not exist")));

            StepVerifier.create(engine.generate(GenerationRequest.of(BUSINESS_ID, SITE)))
                    .assertNext(result -> {
                        assertThat(result.generated()).isZero();
                        assertThat(result.errors()).containsExactly("relation does not exist");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should honor a custom minimum severity")
        void shouldPassMinSeverity() {
            when(patternRepository.findSignificantSince(eq(SITE), any(LocalDateTime.class), eq(0.6)))
                    .thenReturn(Flux.empty());

            StepVerifier.create(engine.generate(GenerationRequest.builder()
                            .businessId(BUSINESS_ID).siteId(SITE).minSeverity(0.6).build()))
                    .assertNext(result -> assertThat(result.generated()).isZero())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("rank")
    class Rank {

        private RecommendationEngine.Candidate candidate(String key, double score, LocalDateTime detectedAt) {
            return new RecommendationEngine.Candidate(
                    Recommendation.builder().recommendationKey(key).build(), score, detectedAt);
        }

        @Test
        @DisplayName("should break score ties by newest detection")
        void shouldPreferNewestOnTie() {
            List<RecommendationEngine.Candidate> ranked = RecommendationEngine.rank(List.of(
                    candidate("a", 1.0, DETECTED.minusDays(1)),
                    candidate("b", 1.0, DETECTED),
                    candidate("c", 2.0, null)), 5);

            assertThat(ranked).extracting(RecommendationEngine.Candidate::key).containsExactly("c", "b", "a");
        }

        @Test
        @DisplayName("should return nothing for a non-positive maximum")
        void shouldHandleZeroMax() {
            assertThat(RecommendationEngine.rank(List.of(candidate("a", 1.0, DETECTED)), 0)).isEmpty();
        }
    }
}
