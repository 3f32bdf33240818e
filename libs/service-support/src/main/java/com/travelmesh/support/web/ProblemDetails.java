package com.travelmesh.support.web;

import com.travelmesh.observability.CorrelationContextHolder;
import com.travelmesh.security.ErrorKind;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the RFC 7807 bodies every TravelMesh service returns on error.
 *
 * <pre>
 * {
 *   "type": "https://travelmesh.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "target not permitted",
 *   "errorKind": "FORBIDDEN",
 *   "timestamp": "2026-03-01T10:00:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
public final class ProblemDetails {

    public static final String ERROR_KIND = "errorKind";

    private ProblemDetails() {
        // utility class
    }

    public static ProblemDetail of(HttpStatus status, ErrorKind kind, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://travelmesh.dev/errors/"
                + kind.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty(ERROR_KIND, kind.name());
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    /** HTTP status a rejected call of this kind is answered with. */
    public static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case DECISION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
            case TOOL_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
