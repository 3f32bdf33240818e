package com.travelmesh.security;

/**
 * A downstream component could not be reached, timed out, or failed.
 */
public class UpstreamUnavailableException extends TravelMeshException {

    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message) {
        super(message);
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    public String upstream() {
        return upstream;
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.UPSTREAM_UNAVAILABLE;
    }
}
