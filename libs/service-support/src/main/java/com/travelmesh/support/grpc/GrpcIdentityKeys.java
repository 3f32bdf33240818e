package com.travelmesh.support.grpc;

import com.travelmesh.observability.CorrelationContext;
import com.travelmesh.security.IdentityHeaders;
import io.grpc.Context;
import io.grpc.Metadata;

/**
 * gRPC metadata and context keys for identity propagation.
 */
public final class GrpcIdentityKeys {

    public static final Metadata.Key<String> CALLER =
            Metadata.Key.of(IdentityHeaders.CALLER, Metadata.ASCII_STRING_MARSHALLER);

    public static final Metadata.Key<String> ORCHESTRATOR_OF_RECORD =
            Metadata.Key.of(IdentityHeaders.ORCHESTRATOR_OF_RECORD, Metadata.ASCII_STRING_MARSHALLER);

    public static final Metadata.Key<String> TARGET =
            Metadata.Key.of(IdentityHeaders.TARGET, Metadata.ASCII_STRING_MARSHALLER);

    public static final Metadata.Key<String> CORRELATION_ID =
            Metadata.Key.of(IdentityHeaders.CORRELATION_ID, Metadata.ASCII_STRING_MARSHALLER);

    /** Trailer carrying the {@link com.travelmesh.security.ErrorKind} of a rejected call. */
    public static final Metadata.Key<String> ERROR_KIND =
            Metadata.Key.of(IdentityHeaders.ERROR_KIND, Metadata.ASCII_STRING_MARSHALLER);

    /** Admitted caller identity, readable by service implementations. */
    public static final Context.Key<String> CALLER_CONTEXT = Context.key("travelmesh-caller");

    /** Correlation context of the call. */
    public static final Context.Key<CorrelationContext> CORRELATION_CONTEXT =
            Context.key("travelmesh-correlation");

    private GrpcIdentityKeys() {
        // utility class
    }
}
