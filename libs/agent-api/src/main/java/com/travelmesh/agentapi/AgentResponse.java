package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of a worker agent processing one request.
 *
 * @param success     whether the request was handled without error
 * @param message     human-readable summary
 * @param data        structured result (tool output, pending confirmation, catalog); may be null
 * @param toolsCalled names of every tool the agent attempted, in order
 * @param error       stable error kind or {@code missing_<field>} when unsuccessful
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("tools_called") List<String> toolsCalled,
        @JsonProperty("error") String error
) {

    public AgentResponse {
        toolsCalled = toolsCalled == null ? List.of() : List.copyOf(toolsCalled);
    }

    public static AgentResponse success(String message, Map<String, Object> data, List<String> toolsCalled) {
        return new AgentResponse(true, message, data, toolsCalled, null);
    }

    public static AgentResponse failure(String message, String error, Map<String, Object> data,
                                        List<String> toolsCalled) {
        return new AgentResponse(false, message, data, toolsCalled, error);
    }
}
