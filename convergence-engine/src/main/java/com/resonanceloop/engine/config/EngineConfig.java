package com.resonanceloop.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.resonanceloop.common.mutation.RequestMutator;
import com.resonanceloop.common.profile.ProfileStore;
import com.resonanceloop.common.scoring.PatternResonanceScorer;
import com.resonanceloop.common.scoring.ResonanceScorer;
import com.resonanceloop.engine.convergence.ConvergenceSettings;
import com.resonanceloop.engine.profile.ClasspathProfileStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Value("${convergence.max-attempts:3}")
    private int maxAttempts;

    @Value("${convergence.threshold:0.85}")
    private double threshold;

    @Value("${convergence.inter-attempt-delay-ms:2000}")
    private long interAttemptDelayMs;

    @Value("${scoring.min-words:20}")
    private int minWords;

    @Value("${profiles.location:classpath*:profiles/*.json}")
    private String profilesLocation;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ConvergenceSettings convergenceSettings() {
        return new ConvergenceSettings(maxAttempts, threshold, Duration.ofMillis(interAttemptDelayMs));
    }

    @Bean
    public ResonanceScorer resonanceScorer() {
        return new PatternResonanceScorer(minWords);
    }

    @Bean
    public RequestMutator requestMutator() {
        return new RequestMutator();
    }

    @Bean
    public ProfileStore profileStore(ObjectMapper objectMapper) {
        return new ClasspathProfileStore(objectMapper, profilesLocation);
    }
}
