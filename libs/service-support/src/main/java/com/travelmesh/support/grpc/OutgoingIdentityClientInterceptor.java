package com.travelmesh.support.grpc;

import com.travelmesh.support.IdentityPropagation;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;

/**
 * Attaches this component's identity, the orchestrator-of-record, the intended target and the
 * correlation id to every outbound gRPC call on a channel.
 */
public class OutgoingIdentityClientInterceptor implements ClientInterceptor {

    private final IdentityPropagation propagation;
    private final String targetIdentity;

    /**
     * @param targetIdentity identity of the component the channel points at
     */
    public OutgoingIdentityClientInterceptor(IdentityPropagation propagation, String targetIdentity) {
        this.propagation = propagation;
        this.targetIdentity = targetIdentity;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
        return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                headers.put(GrpcIdentityKeys.CALLER, propagation.ownIdentity());
                headers.put(GrpcIdentityKeys.TARGET, targetIdentity);
                headers.put(GrpcIdentityKeys.CORRELATION_ID, propagation.correlationId());
                String orchestratorOfRecord = propagation.orchestratorOfRecord();
                if (orchestratorOfRecord != null) {
                    headers.put(GrpcIdentityKeys.ORCHESTRATOR_OF_RECORD, orchestratorOfRecord);
                }
                super.start(responseListener, headers);
            }
        };
    }
}
