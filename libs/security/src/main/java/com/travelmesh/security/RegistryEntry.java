package com.travelmesh.security;

import java.util.Set;

/**
 * One registered identity: its role and the exhaustive whitelist of identities it may call.
 *
 * @param identity       the registered component identity
 * @param role           descriptive role
 * @param allowedTargets identities this caller may reach; empty means it may call nothing
 */
public record RegistryEntry(String identity, Role role, Set<String> allowedTargets) {

    public RegistryEntry {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null for identity " + identity);
        }
        allowedTargets = allowedTargets == null ? Set.of() : Set.copyOf(allowedTargets);
    }

    /** Exact-match membership; no wildcards or prefixes. */
    public boolean mayCall(String target) {
        return allowedTargets.contains(target);
    }
}
