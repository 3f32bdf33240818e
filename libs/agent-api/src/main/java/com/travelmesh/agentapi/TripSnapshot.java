package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of a trip as passed to an agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TripSnapshot(
        @JsonProperty("trip_id") String tripId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("name") String name,
        @JsonProperty("destination") String destination,
        @JsonProperty("origin") String origin,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("end_date") String endDate,
        @JsonProperty("status") String status
) {
}
