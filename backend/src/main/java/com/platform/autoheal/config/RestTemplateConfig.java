package com.platform.autoheal.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration for REST clients used by the control plane.
 * Each collaborator gets its own client so timeouts can be tuned independently.
 */
@Configuration
public class RestTemplateConfig {

    public static final String PREDICTOR = "predictorRestTemplate";
    public static final String METRICS = "metricsRestTemplate";
    public static final String WEBHOOK = "webhookRestTemplate";

    @Bean
    @Qualifier(PREDICTOR)
    public RestTemplate predictorRestTemplate(RestTemplateBuilder builder, AutoHealProperties properties) {
        AutoHealProperties.Predictor predictor = properties.getPredictor();
        return builder
            .rootUri(predictor.getBaseUrl())
            .setConnectTimeout(predictor.getConnectTimeout())
            .setReadTimeout(predictor.getReadTimeout())
            .build();
    }

    @Bean
    @Qualifier(METRICS)
    public RestTemplate metricsRestTemplate(RestTemplateBuilder builder, AutoHealProperties properties) {
        AutoHealProperties.Metrics metrics = properties.getMetrics();
        return builder
            .rootUri(metrics.getBaseUrl())
            .setConnectTimeout(metrics.getConnectTimeout())
            .setReadTimeout(metrics.getReadTimeout())
            .build();
    }

    @Bean
    @Qualifier(WEBHOOK)
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(10))
            .build();
    }
}
