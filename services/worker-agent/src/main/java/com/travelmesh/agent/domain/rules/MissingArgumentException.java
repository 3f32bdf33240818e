package com.travelmesh.agent.domain.rules;

/** A required tool argument could not be found in the request or its context. */
public class MissingArgumentException extends RuntimeException {

    private final String argument;

    public MissingArgumentException(String argument) {
        super("Missing required argument: " + argument);
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }

    /** Stable error code, e.g. {@code missing_hotel_id}. */
    public String errorCode() {
        return "missing_" + argument;
    }
}
