package com.travelmesh.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Transport-independent enforcement for one protected component.
 * <p>
 * The target of every decision is the component's own identity; a caller cannot choose it. A
 * call that declares a different target is rejected without asking the decision point. Any
 * failure to obtain a decision rejects the call ({@link EnforcementOutcome#DECISION_UNAVAILABLE}),
 * never admits it. Exactly one {@link DecisionRecord} is written per call.
 */
public final class EnforcementPoint {

    /** Reason recorded when {@code x-target-id} names another component. */
    public static final String TARGET_MISMATCH = "target mismatch";

    private static final Logger log = LoggerFactory.getLogger(EnforcementPoint.class);

    private final String ownIdentity;
    private final PolicyDecisionClient decisionClient;
    private final DecisionAuditLog auditLog;
    private final Clock clock;

    public EnforcementPoint(String ownIdentity, PolicyDecisionClient decisionClient,
                            DecisionAuditLog auditLog, Clock clock) {
        if (ownIdentity == null || ownIdentity.isBlank()) {
            throw new IllegalArgumentException("ownIdentity must not be null or blank");
        }
        if (decisionClient == null) {
            throw new IllegalArgumentException("decisionClient must not be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.ownIdentity = ownIdentity;
        this.decisionClient = decisionClient;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Decides whether {@code call} may proceed and audits the result.
     */
    public EnforcementResult enforce(InboundCall call) {
        String caller = Identities.orAnonymous(call.presentedCaller());
        EnforcementResult result = evaluate(caller, call);
        auditLog.record(new DecisionRecord(clock.instant(), caller, ownIdentity, call.path(),
                result.outcome(), result.reason()));
        return result;
    }

    public String ownIdentity() {
        return ownIdentity;
    }

    private EnforcementResult evaluate(String caller, InboundCall call) {
        String declared = call.declaredTarget();
        if (declared != null && !declared.isBlank() && !declared.trim().equals(ownIdentity)) {
            return new EnforcementResult(EnforcementOutcome.FORBIDDEN, caller, TARGET_MISMATCH);
        }
        try {
            AuthorizationDecision decision = decisionClient.decide(
                    new AuthorizationRequest(caller, ownIdentity, call.path()));
            if (decision == null) {
                return unavailable(caller, "no decision returned");
            }
            EnforcementOutcome outcome = decision.allow() ? EnforcementOutcome.ALLOWED : EnforcementOutcome.FORBIDDEN;
            return new EnforcementResult(outcome, caller, decision.reason().label());
        } catch (DecisionUnavailableException e) {
            return unavailable(caller, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Decision client failed unexpectedly for caller={} path={}", caller, call.path(), e);
            return unavailable(caller, "decision client error");
        }
    }

    private EnforcementResult unavailable(String caller, String detail) {
        log.warn("No policy decision for caller={} target={}: {}", caller, ownIdentity, detail);
        return new EnforcementResult(EnforcementOutcome.DECISION_UNAVAILABLE, caller, "decision unavailable");
    }
}
