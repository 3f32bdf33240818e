package com.travelmesh.security;

/**
 * How an Enforcement Point obtains a decision.
 */
public interface PolicyDecisionClient {

    /**
     * @throws DecisionUnavailableException if no well-formed decision could be obtained in time
     */
    AuthorizationDecision decide(AuthorizationRequest request);
}
