package com.platform.autoheal.notify;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.config.RestTemplateConfig;
import com.platform.autoheal.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts healing events to a Slack-compatible incoming webhook.
 * Best effort: failures are logged and counted, never propagated.
 */
@Slf4j
@Service
public class WebhookNotifier {

    private final RestTemplate restTemplate;
    private final AutoHealProperties.Notifier config;
    private final MetricsRegistry metricsRegistry;

    public WebhookNotifier(
            @Qualifier(RestTemplateConfig.WEBHOOK) RestTemplate restTemplate,
            AutoHealProperties properties,
            MetricsRegistry metricsRegistry) {
        this.restTemplate = restTemplate;
        this.config = properties.getNotifier();
        this.metricsRegistry = metricsRegistry;
    }

    @Async
    public void notify(HealingEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        String webhookUrl = config.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("No notification webhook configured, skipping {} alert for {}", event.type(), event.workload());
            return;
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Map<String, String>> request = new HttpEntity<>(Map.of("text", event.text()), headers);

            restTemplate.postForEntity(webhookUrl, request, String.class);

            metricsRegistry.recordNotification(event.type().name(), true);
            log.info("Sent {} alert for {}", event.type(), event.workload());
        } catch (RestClientException e) {
            metricsRegistry.recordNotification(event.type().name(), false);
            log.warn("Failed to send {} alert for {}: {}", event.type(), event.workload(), e.getMessage());
        }
    }
}
