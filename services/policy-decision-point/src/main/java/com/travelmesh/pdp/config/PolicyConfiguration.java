package com.travelmesh.pdp.config;

import com.travelmesh.security.PolicyDecisionPoint;
import com.travelmesh.security.PolicyRegistry;
import com.travelmesh.security.RegistryEntry;
import com.travelmesh.security.Role;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfiguration.class);

    @Bean
    public PolicyRegistry policyRegistry(PolicyProperties properties) {
        PolicyRegistry registry = PolicyRegistry.of(toEntries(properties));
        log.info("Loaded policy registry with {} identities", registry.size());
        return registry;
    }

    @Bean
    public PolicyDecisionPoint policyDecisionPoint(PolicyRegistry registry) {
        return new PolicyDecisionPoint(registry);
    }

    /**
     * @throws IllegalArgumentException for an unknown role name
     */
    static List<RegistryEntry> toEntries(PolicyProperties properties) {
        return properties.registry().stream()
                .map(entry -> new RegistryEntry(
                        entry.identity(),
                        Role.fromString(entry.role())
                                .orElseThrow(() -> new IllegalArgumentException(
                                        "Unknown role '%s' for identity '%s'".formatted(entry.role(), entry.identity()))),
                        entry.allowedTargets()))
                .toList();
    }
}
