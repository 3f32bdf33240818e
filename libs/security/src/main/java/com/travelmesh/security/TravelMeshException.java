package com.travelmesh.security;

/**
 * Base class for failures that carry a stable {@link ErrorKind}.
 */
public abstract class TravelMeshException extends RuntimeException {

    protected TravelMeshException(String message) {
        super(message);
    }

    protected TravelMeshException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind errorKind();
}
