package com.travelmesh.support.web;

import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.TravelMeshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a stable {@code
 * errorKind}. Internal details (stack traces, upstream identities) never reach the body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Validation Error", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Bad Request", "Malformed request body");
    }

    @ExceptionHandler(TravelMeshException.class)
    public ProblemDetail handleTravelMesh(TravelMeshException ex) {
        ErrorKind kind = ex.errorKind();
        HttpStatus status = ProblemDetails.statusFor(kind);
        log.warn("Request failed with {}: {}", kind, ex.getMessage());
        return ProblemDetails.of(status, kind, status.getReasonPhrase(), publicDetail(kind));
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return ProblemDetails.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorKind.INTERNAL,
                "Internal Server Error",
                "An unexpected error occurred");
    }

    private static String publicDetail(ErrorKind kind) {
        return switch (kind) {
            case FORBIDDEN -> "The call was not permitted";
            case DECISION_UNAVAILABLE -> "No authorization decision could be obtained";
            case UPSTREAM_UNAVAILABLE -> "A downstream service is unavailable";
            case TOOL_ERROR -> "A tool reported an error";
            case VALIDATION_ERROR -> "The request is invalid";
            case INTERNAL -> "An unexpected error occurred";
        };
    }
}
