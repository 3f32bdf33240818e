package com.travelmesh.orchestrator.domain.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Body of {@code POST /v1/chat}.
 *
 * @param callerId the end user the conversation belongs to
 * @param tripId selects one of the caller's trips as the active one
 * @param parameters structured fields passed through to the agent (e.g. {@code hotel_id})
 * @param confirmed explicit confirmation for bookings and cancellations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
        @JsonProperty("message") @NotBlank @Size(max = 4000) String message,
        @JsonProperty("caller_id") @NotBlank String callerId,
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("trip_id") String tripId,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("confirmed") boolean confirmed) {

    public ChatRequest {
        parameters = parameters == null ? Map.of() : parameters;
    }
}
