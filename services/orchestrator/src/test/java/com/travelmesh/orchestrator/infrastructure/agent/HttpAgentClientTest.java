package com.travelmesh.orchestrator.infrastructure.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;
import com.travelmesh.agentapi.Domain;
import com.travelmesh.orchestrator.domain.agent.AgentEndpoint;
import com.travelmesh.security.DecisionUnavailableException;
import com.travelmesh.security.ForbiddenException;
import com.travelmesh.security.IdentityHeaders;
import com.travelmesh.security.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("HttpAgentClient")
class HttpAgentClientTest {

    private static final AgentEndpoint HOTELS = new AgentEndpoint("hotel-agent", Domain.LODGING, "http://hotels.local");

    private MockRestServiceServer server;
    private HttpAgentClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpAgentClient(builder.build(), new ObjectMapper());
    }

    @Test
    @DisplayName("invoke posts to the agent with its identity as target")
    void invoke() {
        server.expect(requestTo("http://hotels.local/v1/invoke"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(IdentityHeaders.TARGET, "hotel-agent"))
                .andExpect(content().json("{\"message\":\"Find hotels in Miami\",\"conversation_id\":\"c-1\"}"))
                .andRespond(withSuccess(
                        "{\"success\":true,\"message\":\"Found 1 hotel\",\"tools_called\":[\"search_hotels\"]}",
                        MediaType.APPLICATION_JSON));

        AgentResponse response = client.invoke(HOTELS, new AgentRequest("Find hotels in Miami", null, "c-1"));

        assertThat(response.success()).isTrue();
        assertThat(response.toolsCalled()).containsExactly("search_hotels");
        server.verify();
    }

    @Test
    @DisplayName("discover reads the tool catalog")
    void discover() {
        server.expect(requestTo("http://hotels.local/v1/tools"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"agent_id":"hotel-agent","domain":"lodging","description":"Finds and books hotel stays",
                         "tools":[{"name":"search_hotels","required_arguments":["city"],"side_effecting":false}]}
                        """, MediaType.APPLICATION_JSON));

        AgentCatalog catalog = client.discover(HOTELS);

        assertThat(catalog.domain()).isEqualTo(Domain.LODGING);
        assertThat(catalog.toolNames()).containsExactly("search_hotels");
    }

    @Test
    @DisplayName("a problem document keeps its error kind")
    void problemDocument() {
        server.expect(requestTo("http://hotels.local/v1/invoke"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE)
                        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                        .body("{\"status\":503,\"errorKind\":\"DECISION_UNAVAILABLE\"}"));

        assertThatThrownBy(() -> client.invoke(HOTELS, new AgentRequest("hi", null, null)))
                .isInstanceOf(DecisionUnavailableException.class);
    }

    @Test
    @DisplayName("a bare 403 is a denial")
    void bareForbidden() {
        server.expect(requestTo("http://hotels.local/v1/invoke")).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.invoke(HOTELS, new AgentRequest("hi", null, null)))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("server errors are outages")
    void serverError() {
        server.expect(requestTo("http://hotels.local/v1/tools")).andRespond(withServerError());

        assertThatThrownBy(() -> client.discover(HOTELS)).isInstanceOf(UpstreamUnavailableException.class);
    }
}
