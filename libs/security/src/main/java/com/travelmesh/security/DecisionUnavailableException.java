package com.travelmesh.security;

/**
 * No usable policy decision could be obtained: the PDP timed out, was unreachable, or answered
 * with something that is not a decision.
 * <p>
 * WHY a distinct type: this is never a denial. Callers must see it as an outage, not as a
 * policy outcome.
 */
public class DecisionUnavailableException extends TravelMeshException {

    public DecisionUnavailableException(String message) {
        super(message);
    }

    public DecisionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.DECISION_UNAVAILABLE;
    }
}
