package com.travelmesh.support.grpc;

import com.travelmesh.observability.CorrelationContext;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.security.EnforcementOutcome;
import com.travelmesh.security.EnforcementPoint;
import com.travelmesh.security.EnforcementResult;
import com.travelmesh.security.InboundCall;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.UUID;

/**
 * gRPC adapter of the {@link EnforcementPoint}.
 *
 * <p>The enforced path is {@code /<full method name>}. A denied call is closed with {@code
 * PERMISSION_DENIED}, an undecidable one with {@code UNAVAILABLE}; both carry an {@code
 * x-error-kind} trailer. An admitted call runs with the caller in {@link
 * GrpcIdentityKeys#CALLER_CONTEXT} and in the correlation context.
 */
public class GrpcEnforcementInterceptor implements ServerInterceptor {

    private final EnforcementPoint enforcementPoint;
    private final MetricFactory metrics;

    public GrpcEnforcementInterceptor(EnforcementPoint enforcementPoint, MetricFactory metrics) {
        this.enforcementPoint = enforcementPoint;
        this.metrics = metrics;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String orchestratorOfRecord = headers.get(GrpcIdentityKeys.ORCHESTRATOR_OF_RECORD);
        EnforcementResult result =
                enforcementPoint.enforce(
                        new InboundCall(
                                headers.get(GrpcIdentityKeys.CALLER),
                                orchestratorOfRecord,
                                headers.get(GrpcIdentityKeys.TARGET),
                                "/" + call.getMethodDescriptor().getFullMethodName()));
        metrics.increment("travelmesh.enforcement.decisions", "Enforcement decisions",
                result.outcome().tag(), "transport", "grpc");

        if (!result.allowed()) {
            Metadata trailers = new Metadata();
            trailers.put(GrpcIdentityKeys.ERROR_KIND, result.outcome().errorKind().name());
            Status status =
                    result.outcome() == EnforcementOutcome.FORBIDDEN
                            ? Status.PERMISSION_DENIED
                            : Status.UNAVAILABLE;
            call.close(status.withDescription(result.reason()), trailers);
            return new ServerCall.Listener<>() {};
        }

        CorrelationContext correlation = GrpcIdentityKeys.CORRELATION_CONTEXT.get();
        if (correlation == null) {
            correlation = CorrelationContext.of(UUID.randomUUID().toString());
        }
        CorrelationContext admitted =
                correlation.withCaller(
                        result.caller(),
                        orchestratorOfRecord == null || orchestratorOfRecord.isBlank()
                                ? null
                                : orchestratorOfRecord.trim());
        Context context =
                Context.current()
                        .withValue(GrpcIdentityKeys.CALLER_CONTEXT, result.caller())
                        .withValue(GrpcIdentityKeys.CORRELATION_CONTEXT, admitted);

        return new CorrelationScopedListener<>(
                Contexts.interceptCall(context, call, headers, next), admitted);
    }
}
