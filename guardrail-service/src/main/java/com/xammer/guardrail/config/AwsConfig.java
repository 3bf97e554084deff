package com.xammer.guardrail.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.sts.StsClient;

@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String region;

    private DefaultCredentialsProvider getCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public StsClient stsClient() {
        return StsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .build();
    }

    // Organizations is a global endpoint served out of us-east-1
    @Bean
    @ConditionalOnProperty(name = "guardrail.accounts.organizations.discover", havingValue = "true")
    public OrganizationsClient organizationsClient() {
        return OrganizationsClient.builder()
                .region(Region.US_EAST_1)
                .credentialsProvider(getCredentialsProvider())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "guardrail.audit.sink", havingValue = "cloudwatch")
    public CloudWatchLogsClient cloudWatchLogsClient() {
        return CloudWatchLogsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .build();
    }
}
