package com.travelmesh.security;

/**
 * Result of enforcing one call.
 *
 * @param outcome what happened
 * @param caller  effective caller identity ({@code anonymous} if none was presented)
 * @param reason  decision reason, "target mismatch", or the reason no decision was available
 */
public record EnforcementResult(EnforcementOutcome outcome, String caller, String reason) {

    public boolean allowed() {
        return outcome == EnforcementOutcome.ALLOWED;
    }
}
