package com.cred.freestyle.storefront.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;

/**
 * Ships storefront meters to CloudWatch.
 * Only loaded with cloud.aws.cloudwatch.enabled=true; without it Spring Boot's default
 * registry keeps the meters in process (actuator /metrics).
 *
 * @author Storefront Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient cloudWatchAsyncClient(@Value("${cloud.aws.region:us-east-1}") String region) {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public io.micrometer.cloudwatch2.CloudWatchConfig storefrontCloudWatchConfig(
            @Value("${cloud.aws.cloudwatch.namespace:Storefront}") String namespace,
            @Value("${cloud.aws.cloudwatch.batch-size:20}") int batchSize,
            @Value("${cloud.aws.cloudwatch.step:PT1M}") Duration step
    ) {
        // Keys not overridden here fall back to Micrometer's defaults
        return new io.micrometer.cloudwatch2.CloudWatchConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public String namespace() {
                return namespace;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration step() {
                return step;
            }
        };
    }

    @Bean
    public MeterRegistry meterRegistry(io.micrometer.cloudwatch2.CloudWatchConfig storefrontCloudWatchConfig,
                                       CloudWatchAsyncClient cloudWatchAsyncClient,
                                       @Value("${spring.application.name:storefront-core}") String application) {
        CloudWatchMeterRegistry registry =
                new CloudWatchMeterRegistry(storefrontCloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config().commonTags("application", application);
        return registry;
    }
}
