package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One tool as advertised in a catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("required_arguments") List<String> requiredArguments,
        @JsonProperty("optional_arguments") List<String> optionalArguments,
        @JsonProperty("side_effecting") boolean sideEffecting
) {

    public ToolDescriptor {
        requiredArguments = requiredArguments == null ? List.of() : List.copyOf(requiredArguments);
        optionalArguments = optionalArguments == null ? List.of() : List.copyOf(optionalArguments);
    }
}
