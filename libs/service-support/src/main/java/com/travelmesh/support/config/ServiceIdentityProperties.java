package com.travelmesh.support.config;

import com.travelmesh.security.Role;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running component, bound from {@code travelmesh.service.*}.
 *
 * <pre>
 * travelmesh:
 *   service:
 *     identity: hotel-agent
 *     role: worker
 *     environment: production
 *     description: Hotel booking worker
 * </pre>
 *
 * @param identity the identity this component presents on outbound calls and enforces as target
 * @param role descriptive role; a supervisor is its own orchestrator-of-record
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for {@code /v1/identity}
 */
@ConfigurationProperties(prefix = "travelmesh.service")
@Validated
public record ServiceIdentityProperties(
        @NotBlank String identity, Role role, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public ServiceIdentityProperties {
        if (role == null) {
            role = Role.WORKER;
        }
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
