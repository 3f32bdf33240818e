package com.travelmesh.orchestrator.domain.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.travelmesh.agentapi.Domain;
import com.travelmesh.orchestrator.domain.intent.IntentType;
import java.util.List;
import java.util.Map;

/**
 * Body returned by {@code POST /v1/chat}.
 *
 * @param domainUsed set when the request was routed to a domain
 * @param agentUsed identity of the agent that was called, if any
 * @param contextUsed whether the caller had a stored context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("intent") IntentType intent,
        @JsonProperty("domain_used") Domain domainUsed,
        @JsonProperty("agent_used") String agentUsed,
        @JsonProperty("tools_called") List<String> toolsCalled,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("context_used") boolean contextUsed,
        @JsonProperty("error") String error) {

    public ChatResponse {
        toolsCalled = toolsCalled == null ? List.of() : List.copyOf(toolsCalled);
    }
}
