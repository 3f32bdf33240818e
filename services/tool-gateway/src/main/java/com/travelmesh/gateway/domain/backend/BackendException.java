package com.travelmesh.gateway.domain.backend;

/**
 * The booking backend failed or refused an operation. The message is safe to return to the
 * calling agent.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
