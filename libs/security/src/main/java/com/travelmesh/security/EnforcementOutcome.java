package com.travelmesh.security;

/**
 * What an Enforcement Point did with a call.
 */
public enum EnforcementOutcome {

    ALLOWED(null),
    FORBIDDEN(ErrorKind.FORBIDDEN),
    DECISION_UNAVAILABLE(ErrorKind.DECISION_UNAVAILABLE);

    private final ErrorKind errorKind;

    EnforcementOutcome(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    /** Error kind reported to the caller, or null when allowed. */
    public ErrorKind errorKind() {
        return errorKind;
    }

    /** Lower-case label used for metric tags. */
    public String tag() {
        return name().toLowerCase();
    }
}
