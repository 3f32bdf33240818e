package com.travelmesh.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.gateway.domain.backend.BookingBackend;
import com.travelmesh.gateway.domain.session.SessionRegistry;
import com.travelmesh.gateway.domain.tool.ToolCatalog;
import com.travelmesh.gateway.domain.tool.ToolInvoker;
import com.travelmesh.gateway.infrastructure.backend.DemoInventory;
import com.travelmesh.gateway.infrastructure.backend.HttpBookingBackend;
import com.travelmesh.gateway.infrastructure.backend.InMemoryBookingBackend;
import com.travelmesh.gateway.infrastructure.grpc.GrpcServerLifecycle;
import com.travelmesh.gateway.infrastructure.grpc.ToolGatewayGrpcService;
import com.travelmesh.grpc.StructCodec;
import com.travelmesh.observability.ComponentHealth;
import com.travelmesh.observability.HealthCheckRegistry;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import com.travelmesh.support.config.ServiceIdentityProperties;
import com.travelmesh.support.grpc.GrpcCorrelationInterceptor;
import com.travelmesh.support.grpc.GrpcEnforcementInterceptor;
import com.travelmesh.support.grpc.GrpcExceptionInterceptor;
import io.grpc.ServerInterceptor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    /**
     * @throws IllegalStateException if the configured identity is not the domain's gateway
     */
    @Bean
    public ToolCatalog toolCatalog(GatewayProperties properties, ServiceIdentityProperties identity) {
        String expected = properties.domain().gatewayIdentity();
        if (expected == null || !expected.equals(identity.identity())) {
            throw new IllegalStateException("Gateway identity '%s' does not serve domain '%s' (expected '%s')"
                    .formatted(identity.identity(), properties.domain().value(), expected));
        }
        return ToolCatalog.forDomain(properties.domain());
    }

    @Bean
    public BookingBackend bookingBackend(
            GatewayProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        GatewayProperties.Backend backend = properties.backend();
        if (backend.mode() == GatewayProperties.BackendMode.HTTP) {
            if (backend.baseUrl() == null || backend.baseUrl().isBlank()) {
                throw new IllegalStateException("travelmesh.gateway.backend.base-url is required in http mode");
            }
            log.info("Booking backend at {} (timeout {})", backend.baseUrl(), backend.timeout());
            return new HttpBookingBackend(restClientBuilder, backend.baseUrl(), backend.timeout());
        }
        log.info("Using the in-memory {} inventory", properties.domain().value());
        return new InMemoryBookingBackend(DemoInventory.forDomain(properties.domain()), clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(GatewayProperties properties, Clock clock) {
        return new SessionRegistry(clock, properties.sessionTtl());
    }

    @Bean
    public ToolInvoker toolInvoker(
            ToolCatalog catalog,
            BookingBackend backend,
            MetricFactory metrics,
            SensitiveDataRedactor redactor,
            HealthCheckRegistry healthChecks) {
        healthChecks.register("backend", () -> CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            int locations = backend.listLocations().size();
            return ComponentHealth.healthy("backend", (System.nanoTime() - start) / 1_000_000,
                    Map.of("locations", locations));
        }));
        return new ToolInvoker(catalog, backend, metrics, redactor);
    }

    @Bean
    public StructCodec structCodec(ObjectMapper objectMapper) {
        return new StructCodec(objectMapper);
    }

    @Bean
    public ToolGatewayGrpcService toolGatewayGrpcService(
            ServiceIdentityProperties identity,
            ToolInvoker invoker,
            SessionRegistry sessions,
            StructCodec codec) {
        return new ToolGatewayGrpcService(identity.identity(), invoker, sessions, codec);
    }

    /** Interceptor order, outermost last: correlation, enforcement, exception mapping. */
    @Bean
    public GrpcServerLifecycle grpcServerLifecycle(
            GatewayProperties properties,
            ToolGatewayGrpcService service,
            GrpcExceptionInterceptor exceptionInterceptor,
            ObjectProvider<GrpcEnforcementInterceptor> enforcementInterceptor,
            GrpcCorrelationInterceptor correlationInterceptor) {
        List<ServerInterceptor> interceptors = new ArrayList<>();
        interceptors.add(exceptionInterceptor);
        enforcementInterceptor.ifAvailable(interceptors::add);
        interceptors.add(correlationInterceptor);
        if (enforcementInterceptor.getIfAvailable() == null) {
            log.warn("Enforcement is disabled; tool calls are not authorized");
        }
        return new GrpcServerLifecycle(
                properties.grpc().port(), properties.grpc().shutdownGraceSeconds(), service, interceptors);
    }
}
