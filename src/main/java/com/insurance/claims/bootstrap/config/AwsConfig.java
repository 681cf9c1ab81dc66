package com.insurance.claims.bootstrap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS client configuration for evidence media storage.
 */
@Configuration
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(ClaimsProperties claimsProperties) {
        return S3Client.builder()
                .region(Region.of(claimsProperties.getMedia().getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }
}
