package com.travelmesh.security;

import java.util.Optional;

/**
 * Component roles in the mesh.
 * <p>
 * WHY no hierarchy: a role only describes what a component is. Access is decided solely by the
 * registry entry's allowed targets; a supervisor gets nothing it was not explicitly granted.
 */
public enum Role {

    SUPERVISOR("supervisor"),
    WORKER("worker"),
    GATEWAY("gateway"),
    CLIENT("client");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical lower-case name used in configuration (e.g. "worker"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a role by its canonical name, ignoring case.
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
