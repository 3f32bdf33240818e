package com.travelmesh.agent.infrastructure.grpc;

import com.google.protobuf.Struct;
import com.travelmesh.agent.domain.ToolCallResult;
import com.travelmesh.agent.domain.ToolClient;
import com.travelmesh.gateway.v1.InvocationOutcome;
import com.travelmesh.gateway.v1.InvokeToolRequest;
import com.travelmesh.gateway.v1.InvokeToolResponse;
import com.travelmesh.gateway.v1.ListToolsRequest;
import com.travelmesh.gateway.v1.ListToolsResponse;
import com.travelmesh.gateway.v1.ToolGatewayServiceGrpc;
import com.travelmesh.grpc.StructCodec;
import com.travelmesh.security.UpstreamUnavailableException;
import com.travelmesh.support.IdentityPropagation;
import com.travelmesh.support.grpc.GrpcErrorTranslator;
import com.travelmesh.support.grpc.OutgoingIdentityClientInterceptor;
import io.grpc.Channel;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ToolClient} over the gateway's gRPC contract.
 *
 * <p>Holds one gateway session for this agent instance. When the gateway answers {@code
 * SESSION_ESTABLISHED} the new session is kept and the call is repeated once; a second handshake
 * in a row is treated as the gateway being unavailable.
 */
public class GrpcToolGatewayClient implements ToolClient {

    private static final Logger log = LoggerFactory.getLogger(GrpcToolGatewayClient.class);

    private final String gatewayIdentity;
    private final ToolGatewayServiceGrpc.ToolGatewayServiceBlockingStub stub;
    private final StructCodec codec;
    private final Duration deadline;
    private final AtomicReference<String> sessionId = new AtomicReference<>("");

    public GrpcToolGatewayClient(
            Channel channel,
            IdentityPropagation propagation,
            String gatewayIdentity,
            StructCodec codec,
            Duration deadline) {
        this.gatewayIdentity = gatewayIdentity;
        this.stub = ToolGatewayServiceGrpc.newBlockingStub(channel)
                .withInterceptors(new OutgoingIdentityClientInterceptor(propagation, gatewayIdentity));
        this.codec = codec;
        this.deadline = deadline;
    }

    @Override
    public ToolCallResult invoke(String tool, Map<String, Object> arguments) {
        Struct payload = codec.toStruct(arguments);
        InvokeToolResponse response = call(tool, payload, sessionId.get());
        if (response.getOutcome() == InvocationOutcome.SESSION_ESTABLISHED) {
            sessionId.set(response.getSessionId());
            log.debug("Gateway {} opened session {}", gatewayIdentity, response.getSessionId());
            response = call(tool, payload, response.getSessionId());
            if (response.getOutcome() == InvocationOutcome.SESSION_ESTABLISHED) {
                throw new UpstreamUnavailableException(
                        gatewayIdentity, "Gateway " + gatewayIdentity + " did not accept its own session");
            }
        }
        if (!response.getError().isEmpty()) {
            return ToolCallResult.failure(response.getError());
        }
        return ToolCallResult.success(codec.toMap(response.getResult()));
    }

    /** The gateway's tool catalog; also used as its health probe. */
    public ListToolsResponse listTools() {
        try {
            return withDeadline().listTools(ListToolsRequest.getDefaultInstance());
        } catch (StatusRuntimeException e) {
            throw GrpcErrorTranslator.translate(gatewayIdentity, e);
        }
    }

    /** Current session id; empty before the first handshake. */
    public String sessionId() {
        return sessionId.get();
    }

    private InvokeToolResponse call(String tool, Struct payload, String session) {
        InvokeToolRequest request = InvokeToolRequest.newBuilder()
                .setSessionId(session)
                .setToolName(tool)
                .setArguments(payload)
                .build();
        try {
            return withDeadline().invokeTool(request);
        } catch (StatusRuntimeException e) {
            throw GrpcErrorTranslator.translate(gatewayIdentity, e);
        }
    }

    private ToolGatewayServiceGrpc.ToolGatewayServiceBlockingStub withDeadline() {
        return stub.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
    }
}
