package com.travelmesh.support.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.observability.CorrelationContext;
import com.travelmesh.observability.CorrelationContextHolder;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.security.EnforcementPoint;
import com.travelmesh.security.EnforcementResult;
import com.travelmesh.security.IdentityHeaders;
import com.travelmesh.security.InboundCall;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP adapter of the {@link EnforcementPoint}: every request is decided before it reaches a
 * controller.
 *
 * <p>Allowed requests continue with the admitted caller and orchestrator-of-record in the
 * correlation context. Rejected requests are answered here with {@code application/problem+json}:
 * 403 for a denial, 503 when no decision could be obtained.
 */
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class EnforcementFilter extends OncePerRequestFilter {

    static final String DECISIONS_METRIC = "travelmesh.enforcement.decisions";

    private final EnforcementPoint enforcementPoint;
    private final MetricFactory metrics;
    private final ObjectMapper objectMapper;

    public EnforcementFilter(
            EnforcementPoint enforcementPoint, MetricFactory metrics, ObjectMapper objectMapper) {
        this.enforcementPoint = enforcementPoint;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String orchestratorOfRecord = request.getHeader(IdentityHeaders.ORCHESTRATOR_OF_RECORD);
        InboundCall call =
                new InboundCall(
                        request.getHeader(IdentityHeaders.CALLER),
                        orchestratorOfRecord,
                        request.getHeader(IdentityHeaders.TARGET),
                        pathOf(request));
        EnforcementResult result = enforcementPoint.enforce(call);
        metrics.increment(DECISIONS_METRIC, "Enforcement decisions", result.outcome().tag(),
                "transport", "http");

        if (!result.allowed()) {
            reject(response, result);
            return;
        }

        CorrelationContext current =
                CorrelationContextHolder.get()
                        .orElseGet(() -> CorrelationContext.of(UUID.randomUUID().toString()));
        CorrelationContextHolder.set(current.withCaller(result.caller(), blankToNull(orchestratorOfRecord)));
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, EnforcementResult result) throws IOException {
        HttpStatus status = ProblemDetails.statusFor(result.outcome().errorKind());
        ProblemDetail problem =
                ProblemDetails.of(status, result.outcome().errorKind(), status.getReasonPhrase(), result.reason());
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setHeader(IdentityHeaders.ERROR_KIND, result.outcome().errorKind().name());
        objectMapper.writeValue(response.getOutputStream(), problem);
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
