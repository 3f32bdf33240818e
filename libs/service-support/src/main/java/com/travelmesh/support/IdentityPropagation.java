package com.travelmesh.support;

import com.travelmesh.observability.CorrelationContext;
import com.travelmesh.observability.CorrelationContextHolder;
import com.travelmesh.security.Role;
import com.travelmesh.support.config.ServiceIdentityProperties;
import java.util.UUID;

/**
 * Resolves the identity metadata this component attaches to its outbound calls.
 *
 * <p>The orchestrator-of-record is the supervisor the whole chain acts for: a supervisor names
 * itself, any other component forwards what it was called with (falling back to the admitted
 * caller when the call carried none).
 */
public class IdentityPropagation {

    private final String ownIdentity;
    private final boolean supervisor;

    public IdentityPropagation(ServiceIdentityProperties properties) {
        this.ownIdentity = properties.identity();
        this.supervisor = properties.role() == Role.SUPERVISOR;
    }

    public String ownIdentity() {
        return ownIdentity;
    }

    /** Orchestrator-of-record for calls made on the current thread; null if none is known. */
    public String orchestratorOfRecord() {
        if (supervisor) {
            return ownIdentity;
        }
        return CorrelationContextHolder.get()
                .map(ctx -> ctx.onBehalfOf() != null ? ctx.onBehalfOf() : ctx.callerIdentity())
                .orElse(null);
    }

    /** Correlation id of the current request, or a fresh one when called outside a request. */
    public String correlationId() {
        return CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());
    }
}
