package com.travelmesh.support.client;

import com.travelmesh.security.IdentityHeaders;
import com.travelmesh.support.IdentityPropagation;
import java.io.IOException;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Adds {@code x-agent-id}, {@code x-supervisor-id} and {@code x-correlation-id} to outbound HTTP
 * calls. The target ({@code x-target-id}) is per call and set by the client that knows it.
 */
public class OutgoingIdentityInterceptor implements ClientHttpRequestInterceptor {

    private final IdentityPropagation propagation;

    public OutgoingIdentityInterceptor(IdentityPropagation propagation) {
        this.propagation = propagation;
    }

    @Override
    public ClientHttpResponse intercept(
            HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
        request.getHeaders().set(IdentityHeaders.CALLER, propagation.ownIdentity());
        request.getHeaders().set(IdentityHeaders.CORRELATION_ID, propagation.correlationId());
        String orchestratorOfRecord = propagation.orchestratorOfRecord();
        if (orchestratorOfRecord != null) {
            request.getHeaders().set(IdentityHeaders.ORCHESTRATOR_OF_RECORD, orchestratorOfRecord);
        }
        return execution.execute(request, body);
    }
}
