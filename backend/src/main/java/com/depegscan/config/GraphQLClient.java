package com.depegscan.config;

import com.depegscan.client.exception.GraphQLException;
import com.depegscan.client.exception.RetryableApiException;
import com.depegscan.common.RateLimiter;
import com.depegscan.common.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Component
@Slf4j
public class GraphQLClient {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final String url;

    public GraphQLClient(@Qualifier("graphqlRestTemplate") RestTemplate restTemplate,
                         ObjectMapper objectMapper,
                         RateLimiter rateLimiter,
                         RetryPolicy retryPolicy,
                         AppProps props) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.url = props.getApi().getUrl();
    }

    /**
     * Sends a GraphQL POST request and returns the {@code data} node of the response.
     * Transient failures are retried with backoff; the last one is rethrown once attempts run out.
     *
     * @param query GraphQL query string
     * @param variables nullable map of variables
     * @throws RetryableApiException when every attempt failed transiently
     * @throws GraphQLException when the endpoint rejected the query
     */
    public JsonNode post(String query, Map<String, Object> variables) {
        RetryableApiException last = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return execute(query, variables);
            } catch (RetryableApiException e) {
                last = e;
                if (attempt + 1 < maxAttempts) {
                    long delay = retryPolicy.delayMs(attempt);
                    log.warn("[graphql] attempt {}/{} failed: {}; retrying in {}ms",
                            attempt + 1, maxAttempts, e.getMessage(), delay);
                    sleep(delay);
                }
            }
        }
        log.error("[graphql] giving up after {} attempts: {}", maxAttempts, last.getMessage());
        throw last;
    }

    private JsonNode execute(String query, Map<String, Object> variables) {
        rateLimiter.acquire();

        Map<String, Object> payload = new HashMap<>();
        payload.put("query", query);
        payload.put("variables", variables == null ? Map.of() : variables);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        String body;
        try {
            body = restTemplate.postForObject(url, request, String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || e.getStatusCode().is5xxServerError()) {
                throw new RetryableApiException("HTTP " + status + " from GraphQL endpoint", e);
            }
            throw new GraphQLException("HTTP " + status + " from GraphQL endpoint: " + e.getResponseBodyAsString(), null, e);
        } catch (ResourceAccessException e) {
            throw new RetryableApiException("I/O error calling GraphQL endpoint: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new RetryableApiException("GraphQL response body is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RetryableApiException("GraphQL response is not valid JSON", e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            String message = first.path("message").asText("unknown GraphQL error");
            if (isTransient(message)) {
                throw new RetryableApiException("GraphQL error: " + message);
            }
            String code = first.path("extensions").path("code").asText(null);
            throw new GraphQLException(message, code);
        }

        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new GraphQLException("GraphQL response has no data");
        }
        return data;
    }

    static boolean isTransient(String message) {
        if (message == null) return false;
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("timeout") || m.contains("timed out") || m.contains("rate limit")
                || m.contains("too many requests") || m.contains("429");
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryableApiException("Interrupted during GraphQL backoff", ie);
        }
    }
}
