package com.travelmesh.support.web;

import com.travelmesh.observability.ComponentHealth;
import com.travelmesh.observability.HealthCheckRegistry;
import com.travelmesh.observability.HealthResult;
import com.travelmesh.support.config.ServiceIdentityProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and identity endpoints every TravelMesh service exposes. Both are discovery paths,
 * reachable by any caller.
 */
@RestController
public class ServiceInfoController {

    private final ServiceIdentityProperties properties;
    private final HealthCheckRegistry healthChecks;

    public ServiceInfoController(ServiceIdentityProperties properties, HealthCheckRegistry healthChecks) {
        this.properties = properties;
        this.healthChecks = healthChecks;
    }

    /** Liveness plus the state of every registered downstream probe. */
    @GetMapping("/health")
    public Map<String, Object> health() {
        HealthResult result = healthChecks.checkAll();
        Map<String, Object> checks = new LinkedHashMap<>();
        for (ComponentHealth component : result.checks().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", component.status().name());
            if (component.message() != null) {
                entry.put("message", component.message());
            }
            entry.putAll(component.details());
            checks.put(component.name(), entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.status().name());
        body.put("identity", properties.identity());
        body.put("timestamp", result.timestamp().toString());
        body.put("checks", checks);
        return body;
    }

    @GetMapping("/v1/identity")
    public Map<String, Object> identity() {
        return Map.of(
                "identity", properties.identity(),
                "role", properties.role().value(),
                "environment", properties.environment(),
                "description", properties.description());
    }
}
