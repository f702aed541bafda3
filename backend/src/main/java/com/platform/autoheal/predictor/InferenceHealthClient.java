package com.platform.autoheal.predictor;

import com.platform.autoheal.config.RestTemplateConfig;
import com.platform.autoheal.model.InferenceHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads the inference service health document.
 */
@Slf4j
@Component
public class InferenceHealthClient {

    private final RestTemplate restTemplate;

    public InferenceHealthClient(@Qualifier(RestTemplateConfig.PREDICTOR) RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public InferenceHealth check() {
        try {
            InferenceHealth health = restTemplate.getForObject("/healthz", InferenceHealth.class);
            return health != null ? health : InferenceHealth.unreachable("empty health document");
        } catch (RestClientResponseException e) {
            // A model that failed to load answers 503 with the health document as body
            InferenceHealth health = readBody(e);
            return health != null ? health : InferenceHealth.unreachable("HTTP " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Inference service health check failed: {}", e.getMessage());
            return InferenceHealth.unreachable(e.getMessage());
        }
    }

    private static InferenceHealth readBody(RestClientResponseException e) {
        try {
            return e.getResponseBodyAs(InferenceHealth.class);
        } catch (RuntimeException decodeFailure) {
            log.debug("Health error body is not a health document: {}", decodeFailure.getMessage());
            return null;
        }
    }
}
