package com.travelmesh.security;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One hop's question to the decision point: may {@code callerIdentity} reach
 * {@code targetIdentity} at {@code path}? Built fresh for every inbound call.
 *
 * @param callerIdentity identity presented by the caller
 * @param targetIdentity identity of the component being called
 * @param path           request path (HTTP path, or {@code /package.Service/Method} for gRPC)
 */
public record AuthorizationRequest(
        @JsonProperty("caller_identity") String callerIdentity,
        @JsonProperty("target_identity") String targetIdentity,
        @JsonProperty("path") String path
) {
}
