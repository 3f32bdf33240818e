package com.travelmesh.gateway.infrastructure.grpc;

import com.travelmesh.gateway.domain.session.GatewaySession;
import com.travelmesh.gateway.domain.session.SessionRegistry;
import com.travelmesh.gateway.domain.tool.ToolDefinition;
import com.travelmesh.gateway.domain.tool.ToolInvoker;
import com.travelmesh.gateway.domain.tool.ToolResult;
import com.travelmesh.gateway.v1.InvocationOutcome;
import com.travelmesh.gateway.v1.InvokeToolRequest;
import com.travelmesh.gateway.v1.InvokeToolResponse;
import com.travelmesh.gateway.v1.ListToolsRequest;
import com.travelmesh.gateway.v1.ListToolsResponse;
import com.travelmesh.gateway.v1.ToolGatewayServiceGrpc;
import com.travelmesh.gateway.v1.ToolSpec;
import com.travelmesh.grpc.StructCodec;
import com.travelmesh.security.Identities;
import com.travelmesh.support.grpc.GrpcIdentityKeys;
import io.grpc.stub.StreamObserver;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC face of one tool gateway.
 *
 * <p>Runs behind the enforcement interceptor, so the caller in {@link
 * GrpcIdentityKeys#CALLER_CONTEXT} has already been admitted. A call without a live session of
 * that caller opens one and returns {@code SESSION_ESTABLISHED}; the tool does not run until the
 * caller retries with the new id.
 */
public class ToolGatewayGrpcService extends ToolGatewayServiceGrpc.ToolGatewayServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(ToolGatewayGrpcService.class);

    private final String gatewayIdentity;
    private final ToolInvoker invoker;
    private final SessionRegistry sessions;
    private final StructCodec codec;

    public ToolGatewayGrpcService(
            String gatewayIdentity, ToolInvoker invoker, SessionRegistry sessions, StructCodec codec) {
        this.gatewayIdentity = gatewayIdentity;
        this.invoker = invoker;
        this.sessions = sessions;
        this.codec = codec;
    }

    @Override
    public void invokeTool(InvokeToolRequest request, StreamObserver<InvokeToolResponse> responseObserver) {
        String caller = Identities.orAnonymous(GrpcIdentityKeys.CALLER_CONTEXT.get());
        Optional<GatewaySession> session = sessions.resolve(request.getSessionId(), caller);

        if (session.isEmpty()) {
            GatewaySession opened = sessions.open(caller);
            log.info("No live session for {} (presented '{}'); established {}",
                    caller, request.getSessionId(), opened.sessionId());
            responseObserver.onNext(InvokeToolResponse.newBuilder()
                    .setSessionId(opened.sessionId())
                    .setOutcome(InvocationOutcome.SESSION_ESTABLISHED)
                    .build());
            responseObserver.onCompleted();
            return;
        }

        ToolResult result = invoker.invoke(request.getToolName(), codec.toMap(request.getArguments()));
        InvokeToolResponse.Builder response = InvokeToolResponse.newBuilder()
                .setSessionId(session.get().sessionId())
                .setOutcome(InvocationOutcome.EXECUTED);
        if (result.failed()) {
            response.setError(result.error());
        } else {
            response.setResult(codec.toStruct(result.result()));
        }
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    @Override
    public void listTools(ListToolsRequest request, StreamObserver<ListToolsResponse> responseObserver) {
        ListToolsResponse.Builder response = ListToolsResponse.newBuilder()
                .setGatewayIdentity(gatewayIdentity)
                .setDomain(invoker.catalog().domain().value());
        for (ToolDefinition tool : invoker.catalog().definitions()) {
            response.addTools(ToolSpec.newBuilder()
                    .setName(tool.name())
                    .setDescription(tool.description())
                    .addAllRequiredArguments(tool.requiredArguments())
                    .addAllOptionalArguments(tool.optionalArguments())
                    .setSideEffecting(tool.sideEffecting()));
        }
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }
}
