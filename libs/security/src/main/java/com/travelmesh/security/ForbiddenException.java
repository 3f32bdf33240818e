package com.travelmesh.security;

/**
 * A call was denied by policy. Raised by clients that receive a 403 / PERMISSION_DENIED.
 */
public class ForbiddenException extends TravelMeshException {

    private final String target;

    public ForbiddenException(String target, String message) {
        super(message);
        this.target = target;
    }

    public String target() {
        return target;
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.FORBIDDEN;
    }
}
