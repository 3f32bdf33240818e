package com.travelmesh.support.grpc;

import com.travelmesh.security.DecisionUnavailableException;
import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.ForbiddenException;
import com.travelmesh.security.TravelMeshException;
import com.travelmesh.security.UpstreamUnavailableException;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * Client-side counterpart of the server interceptors: turns a failed gRPC call into the matching
 * {@link TravelMeshException}.
 *
 * <p>The {@code x-error-kind} trailer wins; without it the status code decides. Anything that is
 * not a policy outcome is {@code UPSTREAM_UNAVAILABLE}, so a transport failure is never mistaken
 * for a denial.
 */
public final class GrpcErrorTranslator {

    private GrpcErrorTranslator() {
        // utility class
    }

    public static TravelMeshException translate(String target, StatusRuntimeException e) {
        Metadata trailers = e.getTrailers();
        String kindHeader = trailers == null ? null : trailers.get(GrpcIdentityKeys.ERROR_KIND);
        ErrorKind kind = kindHeader != null ? ErrorKind.fromWire(kindHeader) : kindFor(e.getStatus());
        String detail = e.getStatus().getDescription() != null
                ? e.getStatus().getDescription()
                : e.getStatus().getCode().name();
        return switch (kind) {
            case FORBIDDEN -> new ForbiddenException(target, "Call to " + target + " denied: " + detail);
            case DECISION_UNAVAILABLE -> new DecisionUnavailableException(
                    "No decision for call to " + target + ": " + detail, e);
            default -> new UpstreamUnavailableException(target, "Call to " + target + " failed: " + detail, e);
        };
    }

    private static ErrorKind kindFor(Status status) {
        return status.getCode() == Status.Code.PERMISSION_DENIED
                ? ErrorKind.FORBIDDEN
                : ErrorKind.UPSTREAM_UNAVAILABLE;
    }
}
