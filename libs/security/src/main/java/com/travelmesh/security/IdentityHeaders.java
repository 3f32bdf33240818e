package com.travelmesh.security;

/**
 * Names of the identity metadata entries. The same lower-case names are used as HTTP headers
 * and as gRPC metadata keys.
 */
public final class IdentityHeaders {

    /** Identity of the immediate caller. */
    public static final String CALLER = "x-agent-id";

    /** Identity of the orchestrator-of-record the caller acts for. */
    public static final String ORCHESTRATOR_OF_RECORD = "x-supervisor-id";

    /** Identity the caller intends to reach. */
    public static final String TARGET = "x-target-id";

    /** End-to-end correlation id. */
    public static final String CORRELATION_ID = "x-correlation-id";

    /** Stable {@link ErrorKind} name carried on rejected calls. */
    public static final String ERROR_KIND = "x-error-kind";

    private IdentityHeaders() {
        // utility class
    }
}
