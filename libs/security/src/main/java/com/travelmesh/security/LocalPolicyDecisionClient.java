package com.travelmesh.security;

/**
 * Evaluates decisions in-process against a local {@link PolicyDecisionPoint}. Used when a
 * component is configured with an embedded registry instead of a remote PDP.
 */
public final class LocalPolicyDecisionClient implements PolicyDecisionClient {

    private final PolicyDecisionPoint decisionPoint;

    public LocalPolicyDecisionClient(PolicyDecisionPoint decisionPoint) {
        if (decisionPoint == null) {
            throw new IllegalArgumentException("decisionPoint must not be null");
        }
        this.decisionPoint = decisionPoint;
    }

    @Override
    public AuthorizationDecision decide(AuthorizationRequest request) {
        return decisionPoint.decide(request);
    }
}
