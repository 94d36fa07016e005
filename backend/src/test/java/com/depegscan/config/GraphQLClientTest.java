package com.depegscan.config;

import com.depegscan.client.exception.GraphQLException;
import com.depegscan.client.exception.RetryableApiException;
import com.depegscan.common.RateLimiter;
import com.depegscan.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GraphQLClientTest {

    private static final String URL = "http://localhost/graphql";

    private MockRestServiceServer server;
    private GraphQLClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        AppProps props = new AppProps();
        props.getApi().setUrl(URL);
        client = new GraphQLClient(restTemplate, new ObjectMapper(), RateLimiter.withMinInterval(0),
                new RetryPolicy(1, 0, 3), props);
    }

    @Test
    @DisplayName("posts query and variables, returns the data node")
    void returnsDataNode() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.query").value("{ markets { items { uniqueKey } } }"))
                .andExpect(jsonPath("$.variables.skip").value(100))
                .andRespond(withSuccess("{\"data\":{\"markets\":{\"items\":[]}}}", MediaType.APPLICATION_JSON));

        JsonNode data = client.post("{ markets { items { uniqueKey } } }", Map.of("skip", 100));

        assertThat(data.path("markets").path("items").isArray()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("HTTP 429 is retried and the next success is returned")
    void retriesOnTooManyRequests() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"data\":{\"ok\":true}}", MediaType.APPLICATION_JSON));

        JsonNode data = client.post("{ ok }", null);

        assertThat(data.path("ok").asBoolean()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("rate-limit text in GraphQL errors is treated as transient")
    void retriesOnRateLimitErrorMessage() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"errors\":[{\"message\":\"Rate limit exceeded, slow down\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"data\":{\"ok\":1}}", MediaType.APPLICATION_JSON));

        assertThat(client.post("{ ok }", Map.of()).path("ok").asInt()).isEqualTo(1);
        server.verify();
    }

    @Test
    @DisplayName("gives up after max attempts with the transient error")
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        }

        assertThatThrownBy(() -> client.post("{ ok }", Map.of()))
                .isInstanceOf(RetryableApiException.class)
                .hasMessageContaining("503");
        server.verify();
    }

    @Test
    @DisplayName("query errors are not retried")
    void validationErrorIsNotRetried() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"errors\":[{\"message\":\"Cannot query field \\\"foo\\\"\",\"extensions\":{\"code\":\"GRAPHQL_VALIDATION_FAILED\"}}]}",
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.post("{ foo }", Map.of()))
                .isInstanceOf(GraphQLException.class)
                .satisfies(e -> assertThat(((GraphQLException) e).isNotFound()).isFalse());
        server.verify();
    }

    @Test
    @DisplayName("NOT_FOUND errors are recognisable")
    void notFoundIsFlagged() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"errors\":[{\"message\":\"No results matching given parameters\",\"extensions\":{\"code\":\"NOT_FOUND\"}}],\"data\":null}",
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.post("{ vaultByAddress }", Map.of()))
                .isInstanceOf(GraphQLException.class)
                .satisfies(e -> assertThat(((GraphQLException) e).isNotFound()).isTrue());
    }

    @Test
    void isTransient_matchesTimeoutAndRateLimitWording() {
        assertThat(GraphQLClient.isTransient("Query timed out")).isTrue();
        assertThat(GraphQLClient.isTransient("Too Many Requests")).isTrue();
        assertThat(GraphQLClient.isTransient("Unknown argument")).isFalse();
        assertThat(GraphQLClient.isTransient(null)).isFalse();
    }
}
