package com.travelmesh.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.observability.ComponentHealth;
import com.travelmesh.observability.HealthCheckRegistry;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SpanHelper;
import com.travelmesh.orchestrator.domain.agent.AgentClient;
import com.travelmesh.orchestrator.domain.agent.AgentDiscoveryService;
import com.travelmesh.orchestrator.domain.agent.AgentEndpoint;
import com.travelmesh.orchestrator.domain.agent.AgentRegistry;
import com.travelmesh.orchestrator.domain.agent.AgentStatus;
import com.travelmesh.orchestrator.domain.chat.ChatService;
import com.travelmesh.orchestrator.domain.chat.ItineraryFormatter;
import com.travelmesh.orchestrator.domain.context.ContextClient;
import com.travelmesh.orchestrator.domain.intent.DestinationExtractor;
import com.travelmesh.orchestrator.domain.intent.IntentClassifier;
import com.travelmesh.orchestrator.infrastructure.agent.HttpAgentClient;
import com.travelmesh.orchestrator.infrastructure.context.HttpContextClient;
import com.travelmesh.orchestrator.infrastructure.context.InMemoryContextClient;
import com.travelmesh.support.client.OutgoingIdentityInterceptor;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class OrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    @Bean
    public AgentRegistry agentRegistry(
            OrchestratorProperties properties, Clock clock, HealthCheckRegistry healthChecks) {
        AgentRegistry registry = new AgentRegistry(properties.endpoints(), clock);
        for (AgentEndpoint endpoint : registry.endpoints()) {
            log.info("Agent {} serves {} at {}", endpoint.agentId(), endpoint.domain().value(), endpoint.baseUrl());
            healthChecks.register(endpoint.agentId(), () -> CompletableFuture.completedFuture(
                    registry.find(endpoint.domain()).map(OrchestratorConfiguration::agentHealth)
                            .orElseGet(() -> ComponentHealth.unhealthy(endpoint.agentId(), "not registered", 0))));
        }
        return registry;
    }

    private static ComponentHealth agentHealth(AgentStatus status) {
        if (!status.healthy()) {
            return ComponentHealth.unhealthy(status.agentId(), status.lastError(), 0);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", status.domain().value());
        details.put("tools", status.tools().size());
        return ComponentHealth.healthy(status.agentId(), 0, details);
    }

    @Bean
    public AgentClient agentClient(
            OrchestratorProperties properties,
            RestClient.Builder restClientBuilder,
            OutgoingIdentityInterceptor identityInterceptor,
            ObjectMapper objectMapper) {
        return new HttpAgentClient(
                restClientBuilder.clone().requestInterceptor(identityInterceptor),
                properties.dispatchTimeout(),
                objectMapper);
    }

    @Bean
    public AgentDiscoveryService agentDiscoveryService(AgentRegistry registry, AgentClient agentClient) {
        return new AgentDiscoveryService(registry, agentClient);
    }

    @Bean
    public ContextClient contextClient(
            OrchestratorProperties properties,
            RestClient.Builder restClientBuilder,
            OutgoingIdentityInterceptor identityInterceptor,
            HealthCheckRegistry healthChecks) {
        OrchestratorProperties.Context context = properties.context();
        if (context.mode() == OrchestratorProperties.ContextMode.IN_MEMORY) {
            log.info("User context kept in memory");
            healthChecks.register("context", () -> CompletableFuture.completedFuture(
                    ComponentHealth.healthy("context", 0, Map.of("mode", "in-memory"))));
            return new InMemoryContextClient();
        }
        if (context.baseUrl() == null || context.baseUrl().isBlank()) {
            throw new IllegalStateException("travelmesh.orchestrator.context.base-url is required in http mode");
        }
        log.info("User context served by {}", context.baseUrl());
        HttpContextClient client = new HttpContextClient(
                restClientBuilder.clone().requestInterceptor(identityInterceptor), context.baseUrl(), context.timeout());
        healthChecks.register("context", () -> CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            client.ping();
            return ComponentHealth.healthy("context", (System.nanoTime() - start) / 1_000_000,
                    Map.of("mode", "http"));
        }));
        return client;
    }

    @Bean
    public IntentClassifier intentClassifier() {
        return new IntentClassifier();
    }

    @Bean
    public DestinationExtractor destinationExtractor() {
        return new DestinationExtractor();
    }

    @Bean
    public ItineraryFormatter itineraryFormatter() {
        return new ItineraryFormatter();
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("travelmesh-orchestrator"));
    }

    @Bean
    public ChatService chatService(
            ContextClient contextClient,
            IntentClassifier intentClassifier,
            DestinationExtractor destinationExtractor,
            AgentRegistry agentRegistry,
            AgentClient agentClient,
            ItineraryFormatter itineraryFormatter,
            MetricFactory metrics,
            SpanHelper spanHelper) {
        return new ChatService(contextClient, intentClassifier, destinationExtractor, agentRegistry,
                agentClient, itineraryFormatter, metrics, spanHelper);
    }
}
