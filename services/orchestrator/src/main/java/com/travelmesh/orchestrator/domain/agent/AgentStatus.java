package com.travelmesh.orchestrator.domain.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.travelmesh.agentapi.Domain;
import java.time.Instant;
import java.util.List;

/**
 * Registry view of one agent.
 *
 * @param lastCheckedAt null until the first discovery
 */
public record AgentStatus(
        @JsonIgnore AgentEndpoint endpoint,
        @JsonProperty("healthy") boolean healthy,
        @JsonProperty("tools") List<String> tools,
        @JsonProperty("last_checked_at") Instant lastCheckedAt,
        @JsonProperty("last_error") String lastError) {

    public AgentStatus {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    static AgentStatus undiscovered(AgentEndpoint endpoint) {
        return new AgentStatus(endpoint, false, List.of(), null, "not yet discovered");
    }

    @JsonProperty("agent_id")
    public String agentId() {
        return endpoint.agentId();
    }

    @JsonProperty("domain")
    public Domain domain() {
        return endpoint.domain();
    }

    @JsonProperty("url")
    public String url() {
        return endpoint.baseUrl();
    }
}
