package dev.metricfortune.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * The tracking script posts from storefront origins, so the tracking endpoints accept
 * cross-origin requests and expose the rate-limit headers for client backoff.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class TrackingCorsConfig {

    @Value("${tracking.cors.allowed-origins:*}")
    private String allowedOrigins;

    @Bean
    public CorsWebFilter trackingCorsFilter() {
        log.info("Configuring CORS for tracking endpoints");
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(List.of(allowedOrigins.split(",")));
        configuration.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("Content-Type", "Accept", "Origin", "X-Requested-With"));
        configuration.setExposedHeaders(List.of(
                "X-RateLimit-Limit", "X-RateLimit-Remaining", "X-RateLimit-Reset", "Retry-After"
        ));
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/track/**", configuration);
        source.registerCorsConfiguration("/api/track", configuration);
        return new CorsWebFilter(source);
    }
}
