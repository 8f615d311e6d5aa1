package com.resonanceloop.engine.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.model.UsageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link OracleClient} backed by the Anthropic Messages API.
 *
 * <p>Reads the status code and body of every response through {@code exchangeToMono}, so
 * 4xx and 5xx answers come back as {@link RawExchange} values rather than exceptions.
 * Timeouts and connection failures still surface as error signals.
 */
public class AnthropicOracleClient implements OracleClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicOracleClient.class);

    static final String MESSAGES_PATH = "/v1/messages";

    private final WebClient oracleWebClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public AnthropicOracleClient(WebClient oracleWebClient, ObjectMapper objectMapper, String apiKey) {
        this.oracleWebClient = oracleWebClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Oracle] No API key configured. Every exchange will fail as MALFORMED_REQUEST.");
        }
    }

    @Override
    public Mono<RawExchange> sendRaw(String prompt, String directive, OracleParams params) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new IllegalStateException("oracle api key is not configured"));
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(prompt, directive, params)))
            .flatMap(bodyJson ->
                oracleWebClient.post()
                    .uri(MESSAGES_PATH)
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(payload -> toExchange(response.statusCode().value(), payload)))
            );
    }

    Map<String, Object> requestBody(String prompt, String directive, OracleParams params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", params.model());
        body.put("max_tokens", params.maxTokens());
        body.put("temperature", params.temperature());
        if (params.topP() < 1.0) {
            body.put("top_p", params.topP());
        }
        if (directive != null && !directive.isBlank()) {
            body.put("system", directive);
        }
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return body;
    }

    RawExchange toExchange(int statusCode, String payload) {
        JsonNode root;
        try {
            root = payload.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Oracle] Unparseable response body. status={} reason={}", statusCode, e.getOriginalMessage());
            return new RawExchange(statusCode, "", UsageMetadata.none(), "unparseable body");
        }

        if (statusCode < 200 || statusCode >= 300) {
            String message = root.path("error").path("message").asText("");
            return RawExchange.status(statusCode, message.isEmpty() ? null : message);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = root.path("usage");
        UsageMetadata metadata = new UsageMetadata(
            root.path("model").asText(null),
            usage.path("input_tokens").asInt(0),
            usage.path("output_tokens").asInt(0));
        return new RawExchange(statusCode, text.toString(), metadata, null);
    }
}
