package com.travelmesh.support.grpc;

import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.TravelMeshException;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions escaping a gRPC service method to status codes with an {@code x-error-kind}
 * trailer.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT} ({@code VALIDATION_ERROR})
 *   <li>{@link TravelMeshException} → by its error kind
 *   <li>{@link StatusRuntimeException} → preserved
 *   <li>anything else → {@code INTERNAL}
 * </ul>
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            Throwable cause = status.getCause();
                            status = mapException(cause);
                            if (trailers.get(GrpcIdentityKeys.ERROR_KIND) == null) {
                                trailers.put(GrpcIdentityKeys.ERROR_KIND, errorKindOf(cause).name());
                            }
                        }
                        super.close(status, trailers);
                    }
                };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(wrappedCall, headers)) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    closeWith(wrappedCall, e);
                }
            }

            @Override
            public void onHalfClose() {
                // Unary handlers run here; an exception would otherwise reset the stream as UNKNOWN.
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    closeWith(wrappedCall, e);
                }
            }
        };
    }

    private void closeWith(ServerCall<?, ?> call, RuntimeException e) {
        Metadata trailers = new Metadata();
        if (!(e instanceof StatusRuntimeException)) {
            trailers.put(GrpcIdentityKeys.ERROR_KIND, errorKindOf(e).name());
        }
        call.close(mapException(e), trailers);
    }

    /** Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(throwable.getMessage()).withCause(throwable);
        }
        if (throwable instanceof TravelMeshException tme) {
            log.warn("gRPC call failed with {}: {}", tme.errorKind(), tme.getMessage());
            return statusFor(tme.errorKind()).withDescription(tme.getMessage()).withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }

    static Status statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> Status.INVALID_ARGUMENT;
            case FORBIDDEN -> Status.PERMISSION_DENIED;
            case DECISION_UNAVAILABLE, UPSTREAM_UNAVAILABLE -> Status.UNAVAILABLE;
            case TOOL_ERROR -> Status.FAILED_PRECONDITION;
            case INTERNAL -> Status.INTERNAL;
        };
    }

    private static ErrorKind errorKindOf(Throwable throwable) {
        if (throwable instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION_ERROR;
        }
        if (throwable instanceof TravelMeshException tme) {
            return tme.errorKind();
        }
        return ErrorKind.INTERNAL;
    }
}
