package com.insurance.claims.bootstrap.config;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.insurance.claims.application.port.out.DecisionService;
import com.insurance.claims.application.port.out.InFlightGuard;
import com.insurance.claims.application.port.out.MediaPipeline;
import com.insurance.claims.application.port.out.RateLimiter;
import com.insurance.claims.application.port.out.StatusScheduler;
import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.application.service.ClaimSubmissionOrchestrator;
import com.insurance.claims.application.service.DecisionOutcomeMapper;
import com.insurance.claims.application.service.SubmissionEventBus;
import com.insurance.claims.application.service.SubmissionGate;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Application-level bean configuration.
 * <p>
 * Wires application services (core layer) with adapter implementations
 * via constructor injection, maintaining hexagonal architecture boundaries.
 * The core itself has no default collaborators.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper configured for production use.
     * - Java 8 Time support (Instant, Duration)
     * - ISO-8601 dates instead of epoch numbers
     * - Lenient deserialization (ignore unknown properties)
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor for the blocking collaborator calls (S3, Decision Service).
     */
    @Bean(name = "claimsPipelineExecutor")
    public Executor claimsPipelineExecutor(ClaimsProperties claimsProperties) {
        ClaimsProperties.Pipeline pipeline = claimsProperties.getPipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.getCorePoolSize());
        executor.setMaxPoolSize(pipeline.getMaxPoolSize());
        executor.setQueueCapacity(pipeline.getQueueCapacity());
        executor.setThreadNamePrefix("claims-pipeline-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "decisionRestTemplate")
    public RestTemplate decisionRestTemplate(RestTemplateBuilder builder, ClaimsProperties claimsProperties) {
        return builder
                .setConnectTimeout(claimsProperties.getDecision().getConnectTimeout())
                .setReadTimeout(claimsProperties.getDecision().getReadTimeout())
                .build();
    }

    /**
     * Amount, date and rate-limit checks.
     */
    @Bean
    public SubmissionGate submissionGate(RateLimiter rateLimiter, Clock clock) {
        return new SubmissionGate(rateLimiter, clock);
    }

    /**
     * DecisionOutcomeMapper — stateless domain service.
     * No dependencies, pure business logic.
     */
    @Bean
    public DecisionOutcomeMapper decisionOutcomeMapper() {
        return new DecisionOutcomeMapper();
    }

    /**
     * Every SubmissionEventListener bean in the context is subscribed.
     */
    @Bean
    public SubmissionEventBus submissionEventBus(List<SubmissionEventListener> listeners) {
        return new SubmissionEventBus(listeners);
    }

    /**
     * ClaimSubmissionOrchestrator — the core use-case implementation.
     * Wired with all outbound port implementations via DI.
     */
    @Bean
    public ClaimSubmissionOrchestrator claimSubmissionOrchestrator(
            SubmissionGate submissionGate,
            MediaPipeline mediaPipeline,
            DecisionService decisionService,
            StatusScheduler statusScheduler,
            InFlightGuard inFlightGuard,
            DecisionOutcomeMapper decisionOutcomeMapper,
            SubmissionEventBus submissionEventBus,
            ClaimsProperties claimsProperties) {
        return new ClaimSubmissionOrchestrator(
                submissionGate, mediaPipeline, decisionService, statusScheduler,
                inFlightGuard, decisionOutcomeMapper, submissionEventBus,
                claimsProperties.toSubmissionSettings());
    }
}
