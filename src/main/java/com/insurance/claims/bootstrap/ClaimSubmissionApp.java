package com.insurance.claims.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Claim Submission Orchestrator - Application Entry Point.
 * <p>
 * Gates claim submissions, uploads evidence media, submits claims for a
 * decision and publishes the resulting state transitions.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Pattern:      Staged async pipeline (Gate → Media → Decide)
 * Tech:         Spring Boot 3.2 + Kafka + Redis + PostgreSQL + S3
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.insurance.claims")
@ConfigurationPropertiesScan(basePackages = "com.insurance.claims.bootstrap.config")
public class ClaimSubmissionApp {

    public static void main(String[] args) {
        SpringApplication.run(ClaimSubmissionApp.class, args);
    }
}
