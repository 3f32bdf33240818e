package com.travelmesh.pdp.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * The identity registry, bound from {@code travelmesh.policy.registry}.
 *
 * <pre>
 * travelmesh:
 *   policy:
 *     registry:
 *       - identity: hotel-agent
 *         role: worker
 *         allowed-targets: [hotel-gateway]
 * </pre>
 *
 * <p>An empty registry would deny everything but discovery, which is never intended, so startup
 * fails instead.
 */
@ConfigurationProperties(prefix = "travelmesh.policy")
@Validated
public record PolicyProperties(@NotEmpty @Valid List<Entry> registry) {

    /**
     * @param identity registered identity
     * @param role one of supervisor, worker, gateway, client
     * @param allowedTargets exhaustive whitelist of callable identities
     */
    public record Entry(@NotBlank String identity, @NotNull String role, Set<String> allowedTargets) {

        public Entry {
            if (allowedTargets == null) {
                allowedTargets = Set.of();
            }
        }
    }
}
