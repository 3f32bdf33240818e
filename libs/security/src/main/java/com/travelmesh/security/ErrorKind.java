package com.travelmesh.security;

/**
 * Stable error categories visible to callers. Names are part of the wire contract
 * (problem details {@code errorKind}, gRPC {@code x-error-kind} trailer, agent {@code error}).
 */
public enum ErrorKind {

    /** Request failed validation; no downstream call was made. */
    VALIDATION_ERROR,

    /** The policy decision denied the call. */
    FORBIDDEN,

    /** No policy decision could be obtained; the call was rejected fail-secure. */
    DECISION_UNAVAILABLE,

    /** A downstream component was unreachable, timed out or failed. */
    UPSTREAM_UNAVAILABLE,

    /** A tool ran and reported an error result. */
    TOOL_ERROR,

    /** Anything else. */
    INTERNAL;

    /**
     * Parses a wire value, mapping anything unrecognized to {@link #INTERNAL}.
     */
    public static ErrorKind fromWire(String value) {
        if (value == null) {
            return INTERNAL;
        }
        try {
            return valueOf(value.trim());
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}
