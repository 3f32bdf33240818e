package com.travelmesh.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the decision point allowed or denied a request. The label is the wire value.
 */
public enum DecisionReason {

    DISCOVERY_PATH("discovery path", true),
    PERMITTED("permitted", true),
    UNKNOWN_CALLER("unknown caller", false),
    TARGET_NOT_PERMITTED("target not permitted", false),
    MALFORMED_REQUEST("malformed request", false);

    private final String label;
    private final boolean allows;

    DecisionReason(String label, boolean allows) {
        this.label = label;
        this.allows = allows;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Whether a decision with this reason is an allow. */
    public boolean allows() {
        return allows;
    }

    /**
     * @throws IllegalArgumentException for a label no decision point produces
     */
    @JsonCreator
    public static DecisionReason fromLabel(String label) {
        for (DecisionReason reason : values()) {
            if (reason.label.equals(label)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown decision reason: " + label);
    }
}
