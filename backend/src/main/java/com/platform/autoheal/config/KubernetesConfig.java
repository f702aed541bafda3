package com.platform.autoheal.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Kubernetes API client and clock used by the healing components.
 * The client picks up in-cluster service account credentials or the local kubeconfig.
 */
@Slf4j
@Configuration
public class KubernetesConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("Kubernetes client configured for {}", client.getMasterUrl());
        return client;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
