package com.travelmesh.support.grpc;

import com.travelmesh.observability.CorrelationContext;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.UUID;

/**
 * Propagates or generates {@code x-correlation-id} for every gRPC call.
 *
 * <p>Must be the outermost interceptor: the enforcement interceptor reads the correlation context
 * it stores in the gRPC {@link Context}.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String correlationId = headers.get(GrpcIdentityKeys.CORRELATION_ID);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        CorrelationContext correlation = CorrelationContext.of(correlationId);
        Context context = Context.current().withValue(GrpcIdentityKeys.CORRELATION_CONTEXT, correlation);

        return new CorrelationScopedListener<>(
                Contexts.interceptCall(context, call, headers, next), correlation);
    }
}
