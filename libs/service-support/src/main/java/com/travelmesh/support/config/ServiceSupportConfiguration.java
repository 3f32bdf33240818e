package com.travelmesh.support.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.observability.HealthCheckRegistry;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import com.travelmesh.security.DecisionAuditLog;
import com.travelmesh.security.EnforcementPoint;
import com.travelmesh.security.LocalPolicyDecisionClient;
import com.travelmesh.security.PolicyDecisionClient;
import com.travelmesh.security.PolicyDecisionPoint;
import com.travelmesh.security.PolicyRegistry;
import com.travelmesh.security.Slf4jDecisionAuditLog;
import com.travelmesh.support.IdentityPropagation;
import com.travelmesh.support.client.HttpPolicyDecisionClient;
import com.travelmesh.support.client.OutgoingIdentityInterceptor;
import com.travelmesh.support.grpc.GrpcCorrelationInterceptor;
import com.travelmesh.support.grpc.GrpcEnforcementInterceptor;
import com.travelmesh.support.grpc.GrpcExceptionInterceptor;
import com.travelmesh.support.web.CorrelationIdFilter;
import com.travelmesh.support.web.EnforcementFilter;
import com.travelmesh.support.web.GlobalExceptionHandler;
import com.travelmesh.support.web.ServiceInfoController;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.client.RestClient;

/**
 * Infrastructure shared by every TravelMesh service; each application class imports it.
 *
 * <p>Enforcement beans exist unless {@code travelmesh.enforcement.enabled=false} (the PDP, which
 * is not itself protected).
 */
@Configuration
@EnableConfigurationProperties({ServiceIdentityProperties.class, EnforcementProperties.class})
@Import({GlobalExceptionHandler.class, ServiceInfoController.class})
public class ServiceSupportConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ServiceSupportConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdentityPropagation identityPropagation(ServiceIdentityProperties properties) {
        return new IdentityPropagation(properties);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, ServiceIdentityProperties properties) {
        return new MetricFactory(meterRegistry, properties.identity());
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(Clock clock) {
        return new HealthCheckRegistry(HealthCheckRegistry.DEFAULT_TIMEOUT_MS, clock);
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    @Bean
    public OutgoingIdentityInterceptor outgoingIdentityInterceptor(IdentityPropagation propagation) {
        return new OutgoingIdentityInterceptor(propagation);
    }

    @Bean
    public GrpcCorrelationInterceptor grpcCorrelationInterceptor() {
        return new GrpcCorrelationInterceptor();
    }

    @Bean
    public GrpcExceptionInterceptor grpcExceptionInterceptor() {
        return new GrpcExceptionInterceptor();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionAuditLog decisionAuditLog() {
        return new Slf4jDecisionAuditLog();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "travelmesh.enforcement", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PolicyDecisionClient policyDecisionClient(
            EnforcementProperties properties, RestClient.Builder restClientBuilder) {
        if (properties.decisionSource() == EnforcementProperties.DecisionSource.LOCAL) {
            log.warn("Using the embedded stock policy registry; decisions are not made by a remote PDP");
            return new LocalPolicyDecisionClient(new PolicyDecisionPoint(PolicyRegistry.defaults()));
        }
        log.info("Policy decisions from {} (timeout {})", properties.pdpUrl(), properties.pdpTimeout());
        return new HttpPolicyDecisionClient(restClientBuilder, properties.pdpUrl(), properties.pdpTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "travelmesh.enforcement", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EnforcementPoint enforcementPoint(
            ServiceIdentityProperties identity,
            PolicyDecisionClient decisionClient,
            DecisionAuditLog auditLog,
            Clock clock) {
        return new EnforcementPoint(identity.identity(), decisionClient, auditLog, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "travelmesh.enforcement", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EnforcementFilter enforcementFilter(
            EnforcementPoint enforcementPoint, MetricFactory metricFactory, ObjectMapper objectMapper) {
        return new EnforcementFilter(enforcementPoint, metricFactory, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "travelmesh.enforcement", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GrpcEnforcementInterceptor grpcEnforcementInterceptor(
            EnforcementPoint enforcementPoint, MetricFactory metricFactory) {
        return new GrpcEnforcementInterceptor(enforcementPoint, metricFactory);
    }
}
