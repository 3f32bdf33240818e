package com.travelmesh.security;

import java.util.Optional;
import java.util.Set;

/**
 * Default-deny decision algorithm over a {@link PolicyRegistry}.
 * <p>
 * {@link #decide(AuthorizationRequest)} is a pure function of the registry and the request: no
 * I/O, no clock, no mutable state, and it never throws.
 */
public final class PolicyDecisionPoint {

    /** Paths any caller, registered or not, may reach. Exact match only. */
    public static final Set<String> DISCOVERY_PATHS = Set.of(
            "/health",
            "/actuator/health",
            "/v1/tools",
            "/v1/identity",
            "/travelmesh.gateway.v1.ToolGatewayService/ListTools"
    );

    private final PolicyRegistry registry;

    public PolicyDecisionPoint(PolicyRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Decides a single request:
     * <ol>
     *   <li>discovery path → allow</li>
     *   <li>caller not registered → deny</li>
     *   <li>target not in the caller's whitelist → deny</li>
     *   <li>otherwise → allow</li>
     * </ol>
     * A null request or a blank field is denied as malformed.
     */
    public AuthorizationDecision decide(AuthorizationRequest request) {
        if (request == null || isBlank(request.callerIdentity())
                || isBlank(request.targetIdentity()) || isBlank(request.path())) {
            return AuthorizationDecision.deny(DecisionReason.MALFORMED_REQUEST);
        }
        if (DISCOVERY_PATHS.contains(request.path())) {
            return AuthorizationDecision.allow(DecisionReason.DISCOVERY_PATH);
        }
        Optional<RegistryEntry> caller = registry.find(request.callerIdentity());
        if (caller.isEmpty()) {
            return AuthorizationDecision.deny(DecisionReason.UNKNOWN_CALLER);
        }
        if (!caller.get().mayCall(request.targetIdentity())) {
            return AuthorizationDecision.deny(DecisionReason.TARGET_NOT_PERMITTED);
        }
        return AuthorizationDecision.allow(DecisionReason.PERMITTED);
    }

    public PolicyRegistry registry() {
        return registry;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
