package com.travelmesh.agent.config;

import com.travelmesh.agentapi.Domain;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker agent configuration, bound from {@code travelmesh.agent}.
 *
 * @param domain which rule table this agent runs
 */
@ConfigurationProperties(prefix = "travelmesh.agent")
@Validated
public record AgentProperties(
        @NotNull Domain domain,
        @Valid Gateway gateway,
        @Valid LanguageModel languageModel) {

    public AgentProperties {
        if (gateway == null) {
            gateway = new Gateway(null, null, null);
        }
        if (languageModel == null) {
            languageModel = new LanguageModel(null, null);
        }
    }

    /**
     * Where this domain's tool gateway listens.
     *
     * @param deadline per tool call
     */
    public record Gateway(String host, @Min(1) @Max(65535) Integer port, Duration deadline) {

        public Gateway {
            if (host == null || host.isBlank()) {
                host = "localhost";
            }
            if (port == null) {
                port = 9090;
            }
            if (deadline == null) {
                deadline = Duration.ofSeconds(5);
            }
        }
    }

    /**
     * @param url blank disables the fallback model
     */
    public record LanguageModel(String url, Duration timeout) {

        public LanguageModel {
            if (timeout == null) {
                timeout = Duration.ofSeconds(10);
            }
        }

        public boolean enabled() {
            return url != null && !url.isBlank();
        }
    }
}
