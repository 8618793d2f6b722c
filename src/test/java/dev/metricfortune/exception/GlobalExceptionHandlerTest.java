package dev.metricfortune.exception;

import dev.metricfortune.dto.RateLimitDecision;
import dev.metricfortune.entity.RecommendationStatus;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.RequestPath;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    @Mock
    private MessageSource messageSource;

    @Mock
    private ServerWebExchange exchange;

    @Mock
    private ServerHttpRequest request;

    @Mock
    private RequestPath requestPath;

    @Mock
    private LocaleContext localeContext;

    @InjectMocks
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(exchange.getRequest()).thenReturn(request);
        lenient().when(request.getPath()).thenReturn(requestPath);
        lenient().when(requestPath.value()).thenReturn("/api/test");
        lenient().when(exchange.getLocaleContext()).thenReturn(localeContext);
        lenient().when(localeContext.getLocale()).thenReturn(Locale.ENGLISH);
        // key passthrough
        lenient().when(messageSource.getMessage(anyString(), any(), anyString(), any(Locale.class)))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("handleResourceNotFound()")
    class HandleResourceNotFound {

        @Test
        @DisplayName("should return 404 with the message key and path")
        void shouldReturn404() {
            var ex = new ResourceNotFoundException("error.recommendation_not_found");

            StepVerifier.create(handler.handleResourceNotFound(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(404);
                        assertThat(resp.getError()).isEqualTo("error.not_found");
                        assertThat(resp.getMessage()).isEqualTo("error.recommendation_not_found");
                        assertThat(resp.getPath()).isEqualTo("/api/test");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fall back to English without a request locale")
        void shouldFallBackToEnglish() {
            when(localeContext.getLocale()).thenReturn(null);

            StepVerifier.create(handler.handleResourceNotFound(new ResourceNotFoundException("error.business_not_found"), exchange))
                    .assertNext(resp -> assertThat(resp.getStatus()).isEqualTo(404))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleSiteNotRegistered()")
    class HandleSiteNotRegistered {

        @Test
        @DisplayName("should return 401 without echoing the site id")
        void shouldReturn401() {
            StepVerifier.create(handler.handleSiteNotRegistered(new SiteNotRegisteredException("shop-x"), exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(401);
                        assertThat(resp.getMessage()).isEqualTo("error.invalid_site");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleRateLimitExceeded()")
    class HandleRateLimitExceeded {

        @Test
        @DisplayName("should return 429 with rate limit and Retry-After headers")
        void shouldReturn429WithHeaders() {
            Instant reset = Instant.now().plusSeconds(30);
            var ex = new RateLimitExceededException(new RateLimitDecision(false, 1000, 0, reset));

            StepVerifier.create(handler.handleRateLimitExceeded(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                        assertThat(resp.getHeaders().getFirst(RateLimitDecision.LIMIT_HEADER)).isEqualTo("1000");
                        assertThat(resp.getHeaders().getFirst(RateLimitDecision.REMAINING_HEADER)).isEqualTo("0");
                        assertThat(resp.getHeaders().getFirst(RateLimitDecision.RESET_HEADER))
                                .isEqualTo(String.valueOf(reset.toEpochMilli()));
                        assertThat(Long.parseLong(resp.getHeaders().getFirst("Retry-After"))).isBetween(1L, 30L);
                        assertThat(resp.getBody()).isNotNull();
                        assertThat(resp.getBody().getStatus()).isEqualTo(429);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should send at least one second of Retry-After when the window already reset")
        void shouldClampRetryAfter() {
            var ex = new RateLimitExceededException(new RateLimitDecision(false, 10, 0, Instant.now().minusSeconds(5)));

            StepVerifier.create(handler.handleRateLimitExceeded(ex, exchange))
                    .assertNext(resp -> assertThat(resp.getHeaders().getFirst("Retry-After")).isEqualTo("1"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleInvalidTransition()")
    class HandleInvalidTransition {

        @Test
        @DisplayName("should return 409")
        void shouldReturn409() {
            var ex = new InvalidStatusTransitionException(RecommendationStatus.DISMISSED, RecommendationStatus.PLANNED);

            StepVerifier.create(handler.handleInvalidTransition(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(409);
                        assertThat(resp.getMessage()).isEqualTo("error.invalid_status_transition");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleTransientStore()")
    class HandleTransientStore {

        @Test
        @DisplayName("should return 503 without leaking the cause")
        void shouldReturn503() {
            var ex = new TransientStoreException("connection reset by peer", new RuntimeException("io"));

            StepVerifier.create(handler.handleTransientStore(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(503);
                        assertThat(resp.getMessage()).isEqualTo("error.store_unavailable");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleValidationErrors()")
    class HandleValidationErrors {

        @Test
        @DisplayName("should return 400 with field errors")
        void shouldReturnFieldErrors() {
            BindingResult bindingResult = mock(BindingResult.class);
            when(bindingResult.getFieldErrors()).thenReturn(List.of(
                    new FieldError("trackRequest", "events", "At least one event is required"),
                    new FieldError("trackRequest", "events", "duplicate")));
            WebExchangeBindException ex = mock(WebExchangeBindException.class);
            when(ex.getBindingResult()).thenReturn(bindingResult);

            StepVerifier.create(handler.handleValidationErrors(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getValidationErrors())
                                .containsExactlyEntriesOf(Map.of("events", "At least one event is required"));
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleConstraintViolation()")
    class HandleConstraintViolation {

        @Test
        @DisplayName("should key errors by the last path segment")
        void shouldUseLastPathSegment() {
            @SuppressWarnings("unchecked")
            ConstraintViolation<Object> violation = mock(ConstraintViolation.class);
            Path path = mock(Path.class);
            when(path.toString()).thenReturn("list.limit");
            when(violation.getPropertyPath()).thenReturn(path);
            when(violation.getMessage()).thenReturn("must be at most 100");

            StepVerifier.create(handler.handleConstraintViolation(new ConstraintViolationException(Set.of(violation)), exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getValidationErrors()).containsEntry("limit", "must be at most 100");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleIllegalArgument()")
    class HandleIllegalArgument {

        @Test
        @DisplayName("should translate message keys")
        void shouldTranslateKeys() {
            when(messageSource.getMessage("error.mixed_site_batch", new Object[0], "error.mixed_site_batch", Locale.ENGLISH))
                    .thenReturn("All events in a batch must belong to one site");

            StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("error.mixed_site_batch"), exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getMessage()).isEqualTo("All events in a batch must belong to one site");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should sanitize class names and SQL from free text")
        void shouldSanitizeFreeText() {
            var ex = new IllegalArgumentException("Bad value in dev.metricfortune.entity.Pattern SELECT * FROM patterns");

            StepVerifier.create(handler.handleIllegalArgument(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getMessage()).doesNotContain("dev.metricfortune");
                        assertThat(resp.getMessage()).contains("[class]").contains("[query]");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should truncate long messages")
        void shouldTruncate() {
            var ex = new IllegalArgumentException("x".repeat(300));

            StepVerifier.create(handler.handleIllegalArgument(ex, exchange))
                    .assertNext(resp -> assertThat(resp.getMessage()).hasSize(203).endsWith("..."))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleResponseStatus()")
    class HandleResponseStatus {

        @Test
        @DisplayName("should keep the status and translate the reason")
        void shouldKeepStatus() {
            var ex = new ResponseStatusException(HttpStatus.CONFLICT, "error.job_running");

            StepVerifier.create(handler.handleResponseStatus(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                        assertThat(resp.getBody().getError()).isEqualTo("error.conflict");
                        assertThat(resp.getBody().getMessage()).isEqualTo("error.job_running");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should use the status key when there is no reason")
        void shouldUseStatusKey() {
            var ex = new ResponseStatusException(HttpStatus.UNAUTHORIZED);

            StepVerifier.create(handler.handleResponseStatus(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                        assertThat(resp.getBody().getMessage()).isEqualTo("error.unauthorized");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("handleGenericException()")
    class HandleGenericException {

        @Test
        @DisplayName("should return 500 without internals")
        void shouldReturn500() {
            StepVerifier.create(handler.handleGenericException(new IllegalStateException("NPE in repo"), exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(500);
                        assertThat(resp.getMessage()).isEqualTo("error.unexpected_error");
                    })
                    .verifyComplete();
        }
    }
}
