package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Booking domains. Each has one worker agent and one tool gateway.
 */
public enum Domain {

    FLIGHTS("flights", "airline-agent", "airline-gateway"),
    LODGING("lodging", "hotel-agent", "hotel-gateway"),
    VEHICLES("vehicles", "car-rental-agent", "car-rental-gateway"),
    NONE("none", null, null);

    private final String value;
    private final String agentIdentity;
    private final String gatewayIdentity;

    Domain(String value, String agentIdentity, String gatewayIdentity) {
        this.value = value;
        this.agentIdentity = agentIdentity;
        this.gatewayIdentity = gatewayIdentity;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Identity of this domain's worker agent; null for {@link #NONE}. */
    public String agentIdentity() {
        return agentIdentity;
    }

    /** Identity of this domain's tool gateway; null for {@link #NONE}. */
    public String gatewayIdentity() {
        return gatewayIdentity;
    }

    /**
     * Parses the lower-case name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static Domain fromValue(String value) {
        for (Domain domain : values()) {
            if (domain.value.equalsIgnoreCase(value)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + value);
    }
}
