package com.travelmesh.security;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map of identity to {@link RegistryEntry}, loaded once at startup.
 * <p>
 * Safe for unsynchronized concurrent reads. Duplicate identities are rejected at construction so
 * no identity can have two competing whitelists.
 */
public final class PolicyRegistry {

    private final Map<String, RegistryEntry> entries;

    private PolicyRegistry(Map<String, RegistryEntry> entries) {
        this.entries = Map.copyOf(entries);
    }

    /**
     * Builds a registry from the given entries.
     *
     * @throws IllegalArgumentException if an identity appears twice
     */
    public static PolicyRegistry of(Collection<RegistryEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries must not be null");
        }
        Map<String, RegistryEntry> byIdentity = new LinkedHashMap<>();
        for (RegistryEntry entry : entries) {
            if (byIdentity.putIfAbsent(entry.identity(), entry) != null) {
                throw new IllegalArgumentException("Duplicate registry entry for identity '%s'"
                        .formatted(entry.identity()));
            }
        }
        return new PolicyRegistry(byIdentity);
    }

    /**
     * The stock travel deployment: client → planner → workers → their own gateway.
     */
    public static PolicyRegistry defaults() {
        return of(List.of(
                new RegistryEntry(Identities.WEB_CLIENT, Role.CLIENT, Set.of(Identities.TRAVEL_PLANNER)),
                new RegistryEntry(Identities.TRAVEL_PLANNER, Role.SUPERVISOR,
                        Set.of(Identities.AIRLINE_AGENT, Identities.HOTEL_AGENT, Identities.CAR_RENTAL_AGENT)),
                new RegistryEntry(Identities.AIRLINE_AGENT, Role.WORKER, Set.of(Identities.AIRLINE_GATEWAY)),
                new RegistryEntry(Identities.HOTEL_AGENT, Role.WORKER, Set.of(Identities.HOTEL_GATEWAY)),
                new RegistryEntry(Identities.CAR_RENTAL_AGENT, Role.WORKER, Set.of(Identities.CAR_RENTAL_GATEWAY)),
                new RegistryEntry(Identities.AIRLINE_GATEWAY, Role.GATEWAY, Set.of()),
                new RegistryEntry(Identities.HOTEL_GATEWAY, Role.GATEWAY, Set.of()),
                new RegistryEntry(Identities.CAR_RENTAL_GATEWAY, Role.GATEWAY, Set.of())
        ));
    }

    public Optional<RegistryEntry> find(String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(identity));
    }

    public boolean contains(String identity) {
        return identity != null && entries.containsKey(identity);
    }

    public int size() {
        return entries.size();
    }

    public Collection<RegistryEntry> entries() {
        return entries.values();
    }
}
