package com.travelmesh.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.agent.domain.AgentService;
import com.travelmesh.agent.domain.LanguageModelClient;
import com.travelmesh.agent.domain.rules.LocationResolver;
import com.travelmesh.agent.domain.rules.RuleTable;
import com.travelmesh.agent.infrastructure.grpc.GrpcToolGatewayClient;
import com.travelmesh.agent.infrastructure.llm.HttpLanguageModelClient;
import com.travelmesh.grpc.StructCodec;
import com.travelmesh.observability.ComponentHealth;
import com.travelmesh.observability.HealthCheckRegistry;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import com.travelmesh.support.IdentityPropagation;
import com.travelmesh.support.config.ServiceIdentityProperties;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);

    /**
     * @throws IllegalStateException if the configured identity is not the domain's agent
     */
    @Bean
    public RuleTable ruleTable(AgentProperties properties, ServiceIdentityProperties identity) {
        String expected = properties.domain().agentIdentity();
        if (expected == null || !expected.equals(identity.identity())) {
            throw new IllegalStateException("Agent identity '%s' does not serve domain '%s' (expected '%s')"
                    .formatted(identity.identity(), properties.domain().value(), expected));
        }
        return RuleTable.forDomain(properties.domain(), LocationResolver.standard());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ManagedChannel gatewayChannel(AgentProperties properties) {
        AgentProperties.Gateway gateway = properties.gateway();
        log.info("Tool gateway {} at {}:{}", properties.domain().gatewayIdentity(), gateway.host(), gateway.port());
        return ManagedChannelBuilder.forAddress(gateway.host(), gateway.port()).usePlaintext().build();
    }

    @Bean
    public StructCodec structCodec(ObjectMapper objectMapper) {
        return new StructCodec(objectMapper);
    }

    @Bean
    public GrpcToolGatewayClient toolGatewayClient(
            AgentProperties properties,
            ManagedChannel gatewayChannel,
            IdentityPropagation propagation,
            StructCodec codec,
            HealthCheckRegistry healthChecks) {
        String gatewayIdentity = properties.domain().gatewayIdentity();
        GrpcToolGatewayClient client = new GrpcToolGatewayClient(
                gatewayChannel, propagation, gatewayIdentity, codec, properties.gateway().deadline());
        healthChecks.register("gateway", () -> CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            int tools = client.listTools().getToolsCount();
            return ComponentHealth.healthy("gateway", (System.nanoTime() - start) / 1_000_000,
                    Map.of("identity", gatewayIdentity, "tools", tools));
        }));
        return client;
    }

    @Bean
    @ConditionalOnProperty(prefix = "travelmesh.agent.language-model", name = "url")
    public LanguageModelClient languageModelClient(AgentProperties properties, RestClient.Builder restClientBuilder) {
        AgentProperties.LanguageModel model = properties.languageModel();
        log.info("Fallback language model at {}", model.url());
        return new HttpLanguageModelClient(restClientBuilder, model.url(), model.timeout());
    }

    @Bean
    public AgentService agentService(
            RuleTable ruleTable,
            GrpcToolGatewayClient toolClient,
            ObjectProvider<LanguageModelClient> languageModel,
            MetricFactory metrics,
            SensitiveDataRedactor redactor) {
        return new AgentService(ruleTable, toolClient, languageModel.getIfAvailable(), metrics, redactor);
    }
}
