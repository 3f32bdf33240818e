package com.travelmesh.gateway.config;

import com.travelmesh.agentapi.Domain;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration, bound from {@code travelmesh.gateway}.
 *
 * @param domain which tool table this gateway serves
 * @param sessionTtl idle time after which a session is forgotten
 */
@ConfigurationProperties(prefix = "travelmesh.gateway")
@Validated
public record GatewayProperties(
        @NotNull Domain domain,
        @Valid Grpc grpc,
        @Valid Backend backend,
        Duration sessionTtl) {

    public GatewayProperties {
        if (grpc == null) {
            grpc = new Grpc(null, null);
        }
        if (backend == null) {
            backend = new Backend(null, null, null);
        }
        if (sessionTtl == null) {
            sessionTtl = Duration.ofMinutes(30);
        }
    }

    /**
     * @param port 0 picks a free port
     */
    public record Grpc(@Min(0) @Max(65535) Integer port, Long shutdownGraceSeconds) {

        public Grpc {
            if (port == null) {
                port = 9090;
            }
            if (shutdownGraceSeconds == null) {
                shutdownGraceSeconds = 10L;
            }
        }
    }

    /**
     * @param baseUrl required in {@link BackendMode#HTTP} mode
     */
    public record Backend(BackendMode mode, String baseUrl, Duration timeout) {

        public Backend {
            if (mode == null) {
                mode = BackendMode.IN_MEMORY;
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    public enum BackendMode {
        IN_MEMORY,
        HTTP
    }
}
