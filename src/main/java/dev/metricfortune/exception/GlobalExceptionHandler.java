package dev.metricfortune.exception;

import dev.metricfortune.dto.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final Pattern PACKAGE_REF = Pattern.compile("([a-z]+\\.)+[A-Z][a-zA-Z0-9]+");
    private static final Pattern SQL_KEYWORDS = Pattern.compile("(?i)(SELECT|INSERT|UPDATE|DELETE|FROM|WHERE|JOIN)\\s+");
    private static final int MAX_MESSAGE_LENGTH = 200;

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.NOT_FOUND, msg(locale, "error.not_found"), msg(locale, ex.getMessage()), exchange));
    }

    @ExceptionHandler(SiteNotRegisteredException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleSiteNotRegistered(SiteNotRegisteredException ex, ServerWebExchange exchange) {
        log.warn("Tracking rejected for unknown siteId: {}", ex.getSiteId());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.UNAUTHORIZED, msg(locale, "error.unauthorized"), msg(locale, "error.invalid_site"), exchange));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRateLimitExceeded(RateLimitExceededException ex, ServerWebExchange exchange) {
        RateLimitDecision decision = ex.getDecision();
        long retryAfter = decision.retryAfterSeconds();
        log.warn("Tracking rate limit exceeded, limit {}, retry after {}s", decision.limit(), retryAfter);
        Locale locale = resolveLocale(exchange);
        ErrorResponse body = build(HttpStatus.TOO_MANY_REQUESTS, msg(locale, "error.rate_limit_exceeded"),
                msg(locale, "error.rate_limit_retry", retryAfter), exchange);
        return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers -> {
                    decision.writeTo(headers);
                    headers.set("Retry-After", String.valueOf(retryAfter));
                })
                .body(body));
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleInvalidTransition(InvalidStatusTransitionException ex, ServerWebExchange exchange) {
        log.warn("Rejected status transition: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.CONFLICT, msg(locale, "error.conflict"),
                msg(locale, "error.invalid_status_transition", ex.getFrom(), ex.getTo()), exchange));
    }

    @ExceptionHandler(TransientStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleTransientStore(TransientStoreException ex, ServerWebExchange exchange) {
        log.error("Store unavailable: {}", ex.getMessage(), ex);
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.SERVICE_UNAVAILABLE, msg(locale, "error.service_unavailable"),
                msg(locale, "error.store_unavailable"), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg(locale, "error.invalid_value"),
                        (existing, ignored) -> existing
                ));
        log.warn("Validation failed: {}", errors);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, msg(locale, "error.validation_failed"),
                msg(locale, "error.invalid_request_data"), exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });
        log.warn("Constraint violations: {}", errors);
        Locale locale = resolveLocale(exchange);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, msg(locale, "error.validation_failed"),
                msg(locale, "error.invalid_request_params"), exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        // message keys resolve through messages.properties, free text is sanitized
        String translated = msg(locale, ex.getMessage());
        String message = translated.equals(ex.getMessage()) ? sanitize(ex.getMessage(), locale) : translated;
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(locale, "error.bad_request"), message, exchange));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        String reason = ex.getReason() != null ? sanitize(ex.getReason(), locale) : msg(locale, "error.invalid_request");
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(locale, "error.bad_request"), reason, exchange));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        Locale locale = resolveLocale(exchange);
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String errorKey = statusToKey(status);
        String message = ex.getReason() != null ? msg(locale, ex.getReason()) : msg(locale, errorKey);
        return Mono.just(ResponseEntity.status(status).body(build(status, msg(locale, errorKey), message, exchange)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, msg(locale, "error.internal_server_error"),
                msg(locale, "error.unexpected_error"), exchange));
    }

    private ErrorResponse build(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        Locale locale = exchange.getLocaleContext().getLocale();
        return locale != null ? locale : Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    private String sanitize(String message, Locale locale) {
        if (message == null || message.isBlank()) {
            return msg(locale, "error.invalid_request");
        }
        String sanitized = PACKAGE_REF.matcher(message).replaceAll("[class]");
        sanitized = SQL_KEYWORDS.matcher(sanitized).replaceAll("[query] ");
        if (sanitized.length() > MAX_MESSAGE_LENGTH) {
            sanitized = sanitized.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case UNAUTHORIZED, FORBIDDEN -> "error.unauthorized";
            case CONFLICT -> "error.conflict";
            case BAD_REQUEST -> "error.bad_request";
            case TOO_MANY_REQUESTS -> "error.rate_limit_exceeded";
            case SERVICE_UNAVAILABLE -> "error.service_unavailable";
            default -> "error.internal_server_error";
        };
    }
}
