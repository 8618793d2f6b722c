package dev.metricfortune.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI insightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Storefront Insights API")
                        .description("""
                                Behavioral analytics for e-commerce storefronts.

                                ## Features
                                - Event ingestion from the storefront tracking script
                                - Abandonment, hesitation and low-engagement pattern detection
                                - Ranked recommendations with peer-success data
                                - Peer benchmarks and journey funnels

                                ## Caller identity
                                Owner-scoped endpoints read the `X-User-Id` header set by the upstream gateway.
                                """)
                        .version(appVersion))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Development Server")));
    }
}
