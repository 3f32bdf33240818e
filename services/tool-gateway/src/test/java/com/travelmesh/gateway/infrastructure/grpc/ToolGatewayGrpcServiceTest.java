package com.travelmesh.gateway.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.travelmesh.agentapi.Domain;
import com.travelmesh.gateway.domain.session.SessionRegistry;
import com.travelmesh.gateway.domain.tool.ToolCatalog;
import com.travelmesh.gateway.domain.tool.ToolInvoker;
import com.travelmesh.gateway.infrastructure.backend.DemoInventory;
import com.travelmesh.gateway.infrastructure.backend.InMemoryBookingBackend;
import com.travelmesh.gateway.v1.InvocationOutcome;
import com.travelmesh.gateway.v1.InvokeToolRequest;
import com.travelmesh.gateway.v1.InvokeToolResponse;
import com.travelmesh.gateway.v1.ListToolsRequest;
import com.travelmesh.gateway.v1.ListToolsResponse;
import com.travelmesh.gateway.v1.ToolGatewayServiceGrpc;
import com.travelmesh.gateway.v1.ToolSpec;
import com.travelmesh.grpc.StructCodec;
import com.travelmesh.observability.CorrelationContextHolder;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import com.travelmesh.security.EnforcementPoint;
import com.travelmesh.security.Identities;
import com.travelmesh.security.Role;
import com.travelmesh.security.testing.InMemoryDecisionAuditLog;
import com.travelmesh.security.testing.ScriptedPolicyDecisionClient;
import com.travelmesh.support.IdentityPropagation;
import com.travelmesh.support.config.ServiceIdentityProperties;
import com.travelmesh.support.grpc.GrpcCorrelationInterceptor;
import com.travelmesh.support.grpc.GrpcEnforcementInterceptor;
import com.travelmesh.support.grpc.GrpcExceptionInterceptor;
import com.travelmesh.support.grpc.GrpcIdentityKeys;
import com.travelmesh.support.grpc.OutgoingIdentityClientInterceptor;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * The hotel gateway behind the full interceptor chain, over the in-process transport.
 */
@DisplayName("Tool gateway over gRPC")
class ToolGatewayGrpcServiceTest {

    private InMemoryDecisionAuditLog auditLog;
    private ScriptedPolicyDecisionClient decisionClient;
    private SessionRegistry sessions;
    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        auditLog = new InMemoryDecisionAuditLog();
        decisionClient = new ScriptedPolicyDecisionClient();
        sessions = new SessionRegistry(Clock.systemUTC(), Duration.ofMinutes(30));
        var metrics = new MetricFactory(new SimpleMeterRegistry(), Identities.HOTEL_GATEWAY);
        var invoker = new ToolInvoker(
                ToolCatalog.forDomain(Domain.LODGING),
                new InMemoryBookingBackend(DemoInventory.forDomain(Domain.LODGING), Clock.systemUTC()),
                metrics,
                new SensitiveDataRedactor());
        var service = new ToolGatewayGrpcService(
                Identities.HOTEL_GATEWAY, invoker, sessions, new StructCodec(new ObjectMapper()));
        var enforcementPoint =
                new EnforcementPoint(Identities.HOTEL_GATEWAY, decisionClient, auditLog, Clock.systemUTC());

        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(
                        service,
                        new GrpcExceptionInterceptor(),
                        new GrpcEnforcementInterceptor(enforcementPoint, metrics),
                        new GrpcCorrelationInterceptor()))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
        CorrelationContextHolder.clear();
    }

    private ToolGatewayServiceGrpc.ToolGatewayServiceBlockingStub stubAs(String identity) {
        var propagation = new IdentityPropagation(new ServiceIdentityProperties(identity, Role.WORKER, null, null));
        return ToolGatewayServiceGrpc.newBlockingStub(channel)
                .withInterceptors(new OutgoingIdentityClientInterceptor(propagation, Identities.HOTEL_GATEWAY));
    }

    private static InvokeToolRequest searchMiami(String sessionId) {
        return InvokeToolRequest.newBuilder()
                .setSessionId(sessionId)
                .setToolName("search_hotels")
                .setArguments(Struct.newBuilder()
                        .putFields("city", Value.newBuilder().setStringValue("Miami").build()))
                .build();
    }

    @Test
    @DisplayName("first call establishes a session without running the tool; the retry runs it")
    void sessionHandshake() {
        var stub = stubAs(Identities.HOTEL_AGENT);

        InvokeToolResponse first = stub.invokeTool(searchMiami(""));
        assertThat(first.getOutcome()).isEqualTo(InvocationOutcome.SESSION_ESTABLISHED);
        assertThat(first.hasResult()).isFalse();
        assertThat(first.getSessionId()).isNotBlank();

        InvokeToolResponse second = stub.invokeTool(searchMiami(first.getSessionId()));
        assertThat(second.getOutcome()).isEqualTo(InvocationOutcome.EXECUTED);
        assertThat(second.getSessionId()).isEqualTo(first.getSessionId());
        assertThat(second.getError()).isEmpty();
        assertThat(second.getResult().getFieldsOrThrow("hotels").getListValue().getValuesCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("an unknown session id gets a fresh session")
    void unknownSessionReplaced() {
        InvokeToolResponse response = stubAs(Identities.HOTEL_AGENT).invokeTool(searchMiami("stale-session"));

        assertThat(response.getOutcome()).isEqualTo(InvocationOutcome.SESSION_ESTABLISHED);
        assertThat(response.getSessionId()).isNotEqualTo("stale-session");
    }

    @Test
    @DisplayName("an unknown tool is an error result, not a failed call")
    void unsupportedTool() {
        var stub = stubAs(Identities.HOTEL_AGENT);
        String sessionId = stub.invokeTool(searchMiami("")).getSessionId();

        InvokeToolResponse response = stub.invokeTool(
                InvokeToolRequest.newBuilder().setSessionId(sessionId).setToolName("launch_rocket").build());

        assertThat(response.getOutcome()).isEqualTo(InvocationOutcome.EXECUTED);
        assertThat(response.getError()).isEqualTo("unsupported_tool");
    }

    @Test
    @DisplayName("another domain's worker is denied before any session is created")
    void crossDomainDenied() {
        var stub = stubAs(Identities.AIRLINE_AGENT);

        assertThatThrownBy(() -> stub.invokeTool(searchMiami("")))
                .isInstanceOfSatisfying(StatusRuntimeException.class, e -> {
                    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.PERMISSION_DENIED);
                    assertThat(e.getTrailers().get(GrpcIdentityKeys.ERROR_KIND)).isEqualTo("FORBIDDEN");
                });
        assertThat(sessions.size()).isZero();
        assertThat(auditLog.records()).hasSize(1);
    }

    @Test
    @DisplayName("PDP outage fails secure with UNAVAILABLE")
    void pdpOutage() {
        decisionClient.setUnavailable(true);
        var stub = stubAs(Identities.HOTEL_AGENT);

        assertThatThrownBy(() -> stub.invokeTool(searchMiami("")))
                .isInstanceOfSatisfying(StatusRuntimeException.class, e ->
                        assertThat(e.getTrailers().get(GrpcIdentityKeys.ERROR_KIND)).isEqualTo("DECISION_UNAVAILABLE"));
        assertThat(sessions.size()).isZero();
    }

    @Test
    @DisplayName("the tool catalog is a discovery path open to unregistered callers")
    void listToolsForAnyone() {
        ListToolsResponse response = stubAs("curious-visitor").listTools(ListToolsRequest.getDefaultInstance());

        assertThat(response.getGatewayIdentity()).isEqualTo(Identities.HOTEL_GATEWAY);
        assertThat(response.getDomain()).isEqualTo("lodging");
        assertThat(response.getToolsList()).extracting(ToolSpec::getName).containsExactly(
                "list_cities", "search_hotels", "get_hotel_details", "book_hotel", "get_reservation",
                "cancel_reservation");
        assertThat(response.getTools(3).getSideEffecting()).isTrue();
    }
}
