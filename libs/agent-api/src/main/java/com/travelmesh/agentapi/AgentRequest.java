package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/invoke} on a worker agent.
 *
 * @param message        the user's natural-language request
 * @param context        dispatch context; absent means an empty one
 * @param conversationId optional conversation id, echoed in logs only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRequest(
        @JsonProperty("message") String message,
        @JsonProperty("context") DispatchContext context,
        @JsonProperty("conversation_id") String conversationId
) {

    public AgentRequest {
        context = context == null ? DispatchContext.empty() : context;
    }
}
