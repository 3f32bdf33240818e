package com.travelmesh.support.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Enforcement Point settings, bound from {@code travelmesh.enforcement.*}.
 *
 * <pre>
 * travelmesh:
 *   enforcement:
 *     enabled: true
 *     decision-source: remote
 *     pdp-url: http://policy-decision-point:8181
 *     pdp-timeout: 2s
 * </pre>
 *
 * @param enabled whether inbound calls are enforced; only the PDP itself turns this off
 * @param decisionSource {@code remote} (HTTP PDP) or {@code local} (embedded stock registry)
 * @param pdpUrl base URL of the PDP when remote
 * @param pdpTimeout connect and read timeout for one decision
 */
@ConfigurationProperties(prefix = "travelmesh.enforcement")
@Validated
public record EnforcementProperties(
        Boolean enabled, DecisionSource decisionSource, String pdpUrl, Duration pdpTimeout) {

    public EnforcementProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (decisionSource == null) {
            decisionSource = DecisionSource.REMOTE;
        }
        if (pdpUrl == null || pdpUrl.isBlank()) {
            pdpUrl = "http://localhost:8181";
        }
        if (pdpTimeout == null || pdpTimeout.isZero() || pdpTimeout.isNegative()) {
            pdpTimeout = Duration.ofSeconds(2);
        }
    }

    /** Where decisions come from. */
    public enum DecisionSource {
        REMOTE,
        LOCAL
    }
}
