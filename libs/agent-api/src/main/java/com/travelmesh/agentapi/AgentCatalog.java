package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /v1/tools} on a worker agent; used by the orchestrator's discovery.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCatalog(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("domain") Domain domain,
        @JsonProperty("description") String description,
        @JsonProperty("tools") List<ToolDescriptor> tools
) {

    public AgentCatalog {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public List<String> toolNames() {
        return tools.stream().map(ToolDescriptor::name).toList();
    }
}
