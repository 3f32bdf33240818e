package com.travelmesh.orchestrator.config;

import com.travelmesh.agentapi.Domain;
import com.travelmesh.orchestrator.domain.agent.AgentEndpoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Orchestrator configuration, bound from {@code travelmesh.orchestrator}.
 *
 * @param agents one entry per domain
 * @param dispatchTimeout connect and read timeout of agent calls
 * @param discoveryInterval delay between catalog refreshes
 */
@ConfigurationProperties(prefix = "travelmesh.orchestrator")
@Validated
public record OrchestratorProperties(
        @Valid List<Agent> agents,
        Duration dispatchTimeout,
        Duration discoveryInterval,
        @Valid Context context) {

    public OrchestratorProperties {
        agents = agents == null ? List.of() : List.copyOf(agents);
        if (dispatchTimeout == null) {
            dispatchTimeout = Duration.ofSeconds(10);
        }
        if (discoveryInterval == null) {
            discoveryInterval = Duration.ofSeconds(30);
        }
        if (context == null) {
            context = new Context(null, null, null);
        }
    }

    public List<AgentEndpoint> endpoints() {
        return agents.stream().map(Agent::toEndpoint).toList();
    }

    /**
     * @param identity defaults to the domain's agent identity
     */
    public record Agent(@NotNull Domain domain, String identity, @NotBlank String url) {

        AgentEndpoint toEndpoint() {
            String agentId = identity == null || identity.isBlank() ? domain.agentIdentity() : identity;
            String baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            return new AgentEndpoint(agentId, domain, baseUrl);
        }
    }

    public enum ContextMode {
        IN_MEMORY,
        HTTP
    }

    /**
     * Where user context lives.
     *
     * @param baseUrl required when mode is {@code http}
     */
    public record Context(ContextMode mode, String baseUrl, Duration timeout) {

        public Context {
            if (mode == null) {
                mode = ContextMode.IN_MEMORY;
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(3);
            }
        }
    }
}
