package com.travelmesh.support.grpc;

import com.travelmesh.observability.CorrelationContext;
import com.travelmesh.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.ServerCall;

/**
 * Sets the {@link CorrelationContextHolder} around every listener callback.
 *
 * <p>gRPC may deliver callbacks of one call on different executor threads, so the thread-local
 * context is installed per callback rather than once in {@code interceptCall}.
 */
final class CorrelationScopedListener<ReqT>
        extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

    private final CorrelationContext context;

    CorrelationScopedListener(ServerCall.Listener<ReqT> delegate, CorrelationContext context) {
        super(delegate);
        this.context = context;
    }

    @Override
    public void onMessage(ReqT message) {
        CorrelationContextHolder.runWithContext(context, () -> super.onMessage(message));
    }

    @Override
    public void onHalfClose() {
        CorrelationContextHolder.runWithContext(context, super::onHalfClose);
    }

    @Override
    public void onCancel() {
        CorrelationContextHolder.runWithContext(context, super::onCancel);
    }

    @Override
    public void onComplete() {
        CorrelationContextHolder.runWithContext(context, super::onComplete);
    }

    @Override
    public void onReady() {
        CorrelationContextHolder.runWithContext(context, super::onReady);
    }
}
