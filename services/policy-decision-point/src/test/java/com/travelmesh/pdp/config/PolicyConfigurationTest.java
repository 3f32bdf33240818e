package com.travelmesh.pdp.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.travelmesh.security.RegistryEntry;
import com.travelmesh.security.Role;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PolicyConfiguration")
class PolicyConfigurationTest {

    @Test
    @DisplayName("maps configured entries onto registry entries")
    void mapsEntries() {
        PolicyProperties properties = new PolicyProperties(List.of(
                new PolicyProperties.Entry("hotel-agent", "worker", Set.of("hotel-gateway")),
                new PolicyProperties.Entry("hotel-gateway", "gateway", null)));

        List<RegistryEntry> entries = PolicyConfiguration.toEntries(properties);

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).role()).isEqualTo(Role.WORKER);
        assertThat(entries.get(0).mayCall("hotel-gateway")).isTrue();
        assertThat(entries.get(1).allowedTargets()).isEmpty();
    }

    @Test
    @DisplayName("an unknown role fails startup")
    void unknownRoleRejected() {
        PolicyProperties properties = new PolicyProperties(List.of(
                new PolicyProperties.Entry("hotel-agent", "admin", Set.of())));

        assertThatThrownBy(() -> PolicyConfiguration.toEntries(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("admin");
    }

    @Test
    @DisplayName("duplicate identities fail startup")
    void duplicatesRejected() {
        PolicyProperties properties = new PolicyProperties(List.of(
                new PolicyProperties.Entry("hotel-agent", "worker", Set.of()),
                new PolicyProperties.Entry("hotel-agent", "worker", Set.of())));

        assertThatThrownBy(() -> new PolicyConfiguration().policyRegistry(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
