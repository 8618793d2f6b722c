package dev.metricfortune.config;

import dev.metricfortune.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Snowflake generator wiring. The node id comes from {@code app.snowflake.node-id}
 * (env {@code SNOWFLAKE_NODE_ID}); without it, the hostname hash picks one.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = configuredNodeId != null ? configuredNodeId : nodeIdFromHostname();
        log.info("Snowflake id generator using node id {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long nodeIdFromHostname() {
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return Math.abs(hostname.hashCode()) & 0x3FF;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve hostname for node id, using 0: {}", e.getMessage());
            return 0;
        }
    }
}
