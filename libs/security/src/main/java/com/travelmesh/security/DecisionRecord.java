package com.travelmesh.security;

import java.time.Instant;

/**
 * Audit record written exactly once per enforced call.
 */
public record DecisionRecord(
        Instant timestamp,
        String caller,
        String target,
        String path,
        EnforcementOutcome outcome,
        String reason
) {
}
