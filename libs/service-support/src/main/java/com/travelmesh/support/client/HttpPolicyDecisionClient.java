package com.travelmesh.support.client;

import com.travelmesh.security.AuthorizationDecision;
import com.travelmesh.security.AuthorizationRequest;
import com.travelmesh.security.DecisionUnavailableException;
import com.travelmesh.security.PolicyDecisionClient;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Asks a remote PDP ({@code POST /v1/decisions}) for each decision.
 *
 * <p>Timeout, connection failure, any non-2xx answer and any body that is not a well-formed
 * decision all surface as {@link DecisionUnavailableException}; none of them is a denial.
 */
public class HttpPolicyDecisionClient implements PolicyDecisionClient {

    private final RestClient restClient;

    public HttpPolicyDecisionClient(RestClient.Builder builder, String pdpUrl, Duration timeout) {
        this(builder.clone().baseUrl(pdpUrl).requestFactory(requestFactory(timeout)).build());
    }

    /** For a client whose base URL and timeouts are already configured. */
    public HttpPolicyDecisionClient(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return requestFactory;
    }

    @Override
    public AuthorizationDecision decide(AuthorizationRequest request) {
        AuthorizationDecision decision;
        try {
            decision =
                    restClient
                            .post()
                            .uri("/v1/decisions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .body(request)
                            .retrieve()
                            .body(AuthorizationDecision.class);
        } catch (RestClientException e) {
            throw new DecisionUnavailableException("Policy decision point call failed: " + e.getMessage(), e);
        }
        if (decision == null) {
            throw new DecisionUnavailableException("Policy decision point returned an empty body");
        }
        return decision;
    }
}
