package com.travelmesh.orchestrator.infrastructure.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;
import com.travelmesh.orchestrator.domain.agent.AgentClient;
import com.travelmesh.orchestrator.domain.agent.AgentEndpoint;
import com.travelmesh.security.DecisionUnavailableException;
import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.ForbiddenException;
import com.travelmesh.security.IdentityHeaders;
import com.travelmesh.security.TravelMeshException;
import com.travelmesh.security.UpstreamUnavailableException;
import com.travelmesh.support.web.ProblemDetails;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link AgentClient} over the agents' JSON API. Caller, orchestrator-of-record and correlation
 * headers come from the builder's interceptor; the target header is set per agent.
 *
 * <p>A rejected call keeps the agent's {@code errorKind}: a denial is never reported as an outage
 * and an outage never as a denial.
 */
public class HttpAgentClient implements AgentClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpAgentClient(RestClient.Builder builder, Duration timeout, ObjectMapper objectMapper) {
        this(builder.clone().requestFactory(requestFactory(timeout)).build(), objectMapper);
    }

    public HttpAgentClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return requestFactory;
    }

    @Override
    public AgentResponse invoke(AgentEndpoint agent, AgentRequest request) {
        AgentResponse response = call(agent, () -> restClient.post()
                .uri(agent.baseUrl() + "/v1/invoke")
                .header(IdentityHeaders.TARGET, agent.agentId())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(AgentResponse.class));
        if (response == null) {
            throw new UpstreamUnavailableException(agent.agentId(), "Agent " + agent.agentId() + " sent no response");
        }
        return response;
    }

    @Override
    public AgentCatalog discover(AgentEndpoint agent) {
        AgentCatalog catalog = call(agent, () -> restClient.get()
                .uri(agent.baseUrl() + "/v1/tools")
                .header(IdentityHeaders.TARGET, agent.agentId())
                .retrieve()
                .body(AgentCatalog.class));
        if (catalog == null) {
            throw new UpstreamUnavailableException(agent.agentId(), "Agent " + agent.agentId() + " sent no catalog");
        }
        return catalog;
    }

    private <T> T call(AgentEndpoint agent, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw translate(agent, e);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException(agent.agentId(), "Agent " + agent.agentId() + " unreachable", e);
        }
    }

    private TravelMeshException translate(AgentEndpoint agent, RestClientResponseException e) {
        ErrorKind kind = errorKindOf(e);
        String detail = "Agent " + agent.agentId() + " answered " + e.getStatusCode().value();
        return switch (kind) {
            case FORBIDDEN -> new ForbiddenException(agent.agentId(), detail);
            case DECISION_UNAVAILABLE -> new DecisionUnavailableException(detail, e);
            default -> new UpstreamUnavailableException(agent.agentId(), detail, e);
        };
    }

    private ErrorKind errorKindOf(RestClientResponseException e) {
        try {
            JsonNode kind = objectMapper.readTree(e.getResponseBodyAsString()).path(ProblemDetails.ERROR_KIND);
            if (kind.isTextual()) {
                return ErrorKind.fromWire(kind.asText());
            }
        } catch (JsonProcessingException ignored) {
            // not a problem document; fall back to the status code
        }
        return e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN) ? ErrorKind.FORBIDDEN : ErrorKind.UPSTREAM_UNAVAILABLE;
    }
}
