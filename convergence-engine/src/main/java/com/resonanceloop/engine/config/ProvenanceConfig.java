package com.resonanceloop.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.provenance.ProvenanceSink;
import com.resonanceloop.engine.provenance.FileProvenanceSink;
import com.resonanceloop.engine.provenance.LoggingProvenanceSink;
import com.resonanceloop.engine.provenance.RestProvenanceSink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;

/**
 * Selects the {@link ProvenanceSink} by {@code provenance.sink}: {@code file} (default),
 * {@code rest} or {@code none}.
 */
@Configuration
public class ProvenanceConfig {

    @Value("${provenance.directory:./provenance}")
    private String directory;

    @Value("${provenance.base-url:http://localhost:8090}")
    private String provenanceUrl;

    @Bean
    @ConditionalOnProperty(name = "provenance.sink", havingValue = "file", matchIfMissing = true)
    public ProvenanceSink fileProvenanceSink(ObjectMapper objectMapper) {
        return new FileProvenanceSink(objectMapper, Path.of(directory));
    }

    @Bean
    @ConditionalOnProperty(name = "provenance.sink", havingValue = "rest")
    public ProvenanceSink restProvenanceSink(WebClient.Builder builder) {
        return new RestProvenanceSink(builder.baseUrl(provenanceUrl).build());
    }

    @Bean
    @ConditionalOnProperty(name = "provenance.sink", havingValue = "none")
    public ProvenanceSink loggingProvenanceSink() {
        return new LoggingProvenanceSink();
    }
}
