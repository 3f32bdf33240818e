package com.travelmesh.agent.infrastructure.llm;

import com.travelmesh.agent.domain.LanguageModelClient;
import com.travelmesh.security.UpstreamUnavailableException;
import java.time.Duration;
import java.util.Map;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Language model behind a small JSON API.
 *
 * <pre>
 * POST {base}/v1/generate  {"prompt": ...}  -> {"text": ...}
 * </pre>
 */
public class HttpLanguageModelClient implements LanguageModelClient {

    static final String UPSTREAM = "language-model";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HttpLanguageModelClient(RestClient.Builder builder, String baseUrl, Duration timeout) {
        this(builder.clone().baseUrl(baseUrl).requestFactory(requestFactory(timeout)).build());
    }

    public HttpLanguageModelClient(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return requestFactory;
    }

    @Override
    public String generate(String prompt) {
        return field(post("/v1/generate", Map.of("prompt", prompt)), "text");
    }

    private Map<String, Object> post(String path, Map<String, Object> body) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "Language model call to " + path + " failed", e);
        }
    }

    private static String field(Map<String, Object> body, String name) {
        Object value = body == null ? null : body.get(name);
        if (value == null) {
            throw new UpstreamUnavailableException(UPSTREAM, "Language model response has no '" + name + "'");
        }
        return value.toString();
    }
}
