package com.decisionswarm.swarm.llm;

import com.decisionswarm.common.exception.InferenceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link InferenceClient} speaking the Messages API over the shared, pooled
 * {@code inferenceWebClient}. The agent's region picks the base URL; nothing else about
 * the request depends on the region.
 *
 * <p>Every transport problem (connection failure, non-2xx status, empty body, a body
 * without completion text) surfaces as an {@link InferenceException}. The call is fully
 * non-blocking; cancelling the subscription aborts the exchange.
 */
@Component
public class HttpInferenceClient implements InferenceClient {

    static final String API_KEY_HEADER = "x-api-key";
    static final String API_VERSION_HEADER = "anthropic-version";

    private final WebClient inferenceWebClient;
    private final ObjectMapper objectMapper;
    private final InferenceProperties properties;

    public HttpInferenceClient(@Qualifier("inferenceWebClient") WebClient inferenceWebClient,
                               ObjectMapper objectMapper,
                               InferenceProperties properties) {
        this.inferenceWebClient = inferenceWebClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Mono<String> complete(String region, String prompt) {
        String baseUrl = properties.resolveEndpoint(region);
        if (baseUrl == null) {
            return Mono.error(new InferenceException(region, "no inference endpoint configured for region"));
        }

        Map<String, Object> requestBody = Map.of(
            "model", properties.getModel(),
            "max_tokens", properties.getMaxTokens(),
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                inferenceWebClient.post()
                    .uri(baseUrl + properties.getCompletionPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(API_KEY_HEADER, properties.getApiKey())
                    .header(API_VERSION_HEADER, properties.getApiVersion())
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .onErrorMap(WebClientException.class,
                e -> new InferenceException(region, "request failed: " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new InferenceException(region, "empty response body")))
            .map(response -> extractText(region, response));
    }

    private String extractText(String region, String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new InferenceException(region, "response envelope is not JSON", e);
        }
        JsonNode first = root.path("content").path(0);
        if (!first.path("text").isTextual()) {
            throw new InferenceException(region, "response envelope has no completion text");
        }
        return first.path("text").asText();
    }
}
