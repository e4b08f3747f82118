package com.platform.gatewayctl.config;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.client.RetryingControlPlaneClient;
import com.platform.gatewayctl.client.aws.AwsApiGatewayControlPlane;
import com.platform.gatewayctl.client.memory.InMemoryControlPlane;
import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;
import com.platform.gatewayctl.observability.MetricsRegistry;
import com.platform.gatewayctl.retry.RetryEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.ApiGatewayClientBuilder;

import java.net.URI;

/**
 * Wires the control-plane client selected by {@code gateway.control-plane}.
 * Whichever backs it, callers get it wrapped with retries and call metrics.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class ControlPlaneConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "gateway", name = "control-plane", havingValue = "aws", matchIfMissing = true)
    public ApiGatewayClient apiGatewayClient(GatewayProperties properties) {
        GatewayProperties.Aws aws = properties.getAws();
        ApiGatewayClientBuilder builder = ApiGatewayClient.builder()
            .region(Region.of(properties.getRegion()))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(aws.getApiCallTimeout())
                .apiCallAttemptTimeout(aws.getApiCallAttemptTimeout())
                // retried by RetryEngine
                .retryPolicy(RetryPolicy.none())
                .build());
        if (aws.getEndpointOverride() != null && !aws.getEndpointOverride().isBlank()) {
            builder.endpointOverride(URI.create(aws.getEndpointOverride()));
        }
        log.info("Using AWS API Gateway control plane in {}", properties.getRegion());
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "control-plane", havingValue = "aws", matchIfMissing = true)
    public AwsApiGatewayControlPlane awsControlPlane(ApiGatewayClient apiGatewayClient) {
        return new AwsApiGatewayControlPlane(apiGatewayClient);
    }

    /**
     * Dry-run control plane, seeded with an empty API of the configured name.
     */
    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "control-plane", havingValue = "in-memory")
    public InMemoryControlPlane inMemoryControlPlane(GatewayProperties properties) {
        InMemoryControlPlane controlPlane = new InMemoryControlPlane();
        controlPlane.createApi(properties.getApiName());
        log.info("Using in-memory control plane (dry run) for API {}", properties.getApiName());
        return controlPlane;
    }

    @Bean
    @Primary
    public ControlPlaneClient controlPlaneClient(
            GatewayProperties properties,
            ObjectProvider<AwsApiGatewayControlPlane> awsControlPlane,
            ObjectProvider<InMemoryControlPlane> inMemoryControlPlane,
            RetryEngine retryEngine,
            MetricsRegistry metricsRegistry) {
        ControlPlaneClient backend = switch (properties.getControlPlane()) {
            case AWS -> awsControlPlane.getIfAvailable();
            case IN_MEMORY -> inMemoryControlPlane.getIfAvailable();
        };
        if (backend == null) {
            throw new ValidationException(ErrorCode.CONFIGURATION_ERROR,
                "No control plane backend for mode " + properties.getControlPlane());
        }
        return new RetryingControlPlaneClient(backend, retryEngine, metricsRegistry);
    }
}
