package com.resonanceloop.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.engine.transport.AnthropicOracleClient;
import com.resonanceloop.engine.transport.OracleClient;
import com.resonanceloop.engine.transport.OracleParams;
import com.resonanceloop.engine.transport.ReliableTransport;
import com.resonanceloop.engine.transport.Transport;
import com.resonanceloop.engine.transport.TransportSettings;
import com.resonanceloop.engine.transport.TransportTelemetry;
import io.netty.channel.ChannelOption;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class OracleConfig {

    // ── Oracle endpoint ───────────────────────────────────────────────────────

    @Value("${oracle.base-url:https://api.anthropic.com}")
    private String baseUrl;

    @Value("${oracle.api-key:}")
    private String apiKey;

    @Value("${oracle.api-version:2023-06-01}")
    private String apiVersion;

    @Value("${oracle.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    // ── generation parameters ─────────────────────────────────────────────────

    @Value("${oracle.model:claude-sonnet-4-6}")
    private String model;

    @Value("${oracle.max-tokens:4096}")
    private int maxTokens;

    @Value("${oracle.temperature:0.7}")
    private double temperature;

    @Value("${oracle.top-p:1.0}")
    private double topP;

    // ── reliability ───────────────────────────────────────────────────────────

    @Value("${transport.max-retries:3}")
    private int maxRetries;

    @Value("${transport.base-delay-ms:1000}")
    private long baseDelayMs;

    @Value("${transport.request-timeout-ms:60000}")
    private long requestTimeoutMs;

    @Bean
    public WebClient oracleWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(requestTimeoutMs));

        return builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", apiVersion)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public OracleClient oracleClient(WebClient oracleWebClient, ObjectMapper objectMapper) {
        return new AnthropicOracleClient(oracleWebClient, objectMapper, apiKey);
    }

    @Bean
    public OracleParams oracleParams() {
        return new OracleParams(model, maxTokens, temperature, topP);
    }

    @Bean
    public TransportSettings transportSettings() {
        return new TransportSettings(maxRetries, Duration.ofMillis(baseDelayMs), Duration.ofMillis(requestTimeoutMs));
    }

    @Bean
    public TransportTelemetry transportTelemetry() {
        return new TransportTelemetry();
    }

    @Bean
    public Transport transport(OracleClient oracleClient, OracleParams oracleParams,
                               TransportSettings transportSettings, TransportTelemetry transportTelemetry) {
        return new ReliableTransport(oracleClient, oracleParams, transportSettings, transportTelemetry);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(OracleConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
