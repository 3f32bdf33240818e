package com.travelmesh.security;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link PolicyDecisionPoint#decide(AuthorizationRequest)}.
 *
 * @param allow  whether the call may proceed
 * @param reason why; always consistent with {@code allow}
 */
public record AuthorizationDecision(
        @JsonProperty("allow") boolean allow,
        @JsonProperty("reason") DecisionReason reason
) {

    public AuthorizationDecision {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (reason.allows() != allow) {
            throw new IllegalArgumentException("reason '%s' contradicts allow=%s".formatted(reason.label(), allow));
        }
    }

    public static AuthorizationDecision allow(DecisionReason reason) {
        return new AuthorizationDecision(true, reason);
    }

    public static AuthorizationDecision deny(DecisionReason reason) {
        return new AuthorizationDecision(false, reason);
    }
}
