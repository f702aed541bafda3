package com.platform.autoheal.predictor;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.config.RestTemplateConfig;
import com.platform.autoheal.error.TransientIOException;
import com.platform.autoheal.model.FeatureRecord;
import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * Maps a feature snapshot to a risk assessment through the inference service.
 *
 * Never throws: when the service is down, the circuit is open or the answer is malformed,
 * the score comes from {@link FallbackRiskHeuristic} and the assessment is marked degraded.
 * The HIGH/LOW label is always derived locally from the configured threshold.
 */
@Slf4j
@Component
public class RiskPredictor {

    private static final String PREDICT_PATH = "/predict";

    private final RestTemplate restTemplate;
    private final AutoHealProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public RiskPredictor(
            @Qualifier(RestTemplateConfig.PREDICTOR) RestTemplate restTemplate,
            AutoHealProperties properties,
            MetricsRegistry metricsRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("predictor");
        this.retry = retryRegistry.retry("predictor");
    }

    public RiskAssessment assess(FeatureRecord features) {
        double threshold = properties.getRisk().getThreshold();

        PredictResponse response;
        try {
            Supplier<PredictResponse> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, () -> predict(features)));
            response = call.get();
        } catch (CallNotPermittedException e) {
            log.debug("Predictor circuit is open, using fallback heuristic");
            return fallback(features, threshold, "circuit_open");
        } catch (TransientIOException | RestClientException e) {
            log.warn("Inference service unavailable, using fallback heuristic: {}", e.getMessage());
            return fallback(features, threshold, "unreachable");
        }

        String malformed = response != null ? response.malformedReason() : "empty body";
        if (malformed != null) {
            log.warn("Inference service answered unusable prediction ({}), using fallback heuristic", malformed);
            return fallback(features, threshold, "malformed");
        }

        RiskAssessment assessment = RiskAssessment.of(response.probability(), threshold, false);
        if (response.risk() != null && !response.risk().equalsIgnoreCase(assessment.riskLabel().name())) {
            log.info("Inference service labelled risk {} but local threshold {} gives {}",
                response.risk(), threshold, assessment.riskLabel());
        }
        return assessment;
    }

    private PredictResponse predict(FeatureRecord features) {
        try {
            return restTemplate.postForObject(PREDICT_PATH, features, PredictResponse.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw TransientIOException.predictor("Inference service answered " + e.getStatusCode().value(), e);
            }
            throw e;
        } catch (ResourceAccessException e) {
            throw TransientIOException.predictor("Inference service unreachable: " + e.getMessage(), e);
        }
    }

    private RiskAssessment fallback(FeatureRecord features, double threshold, String reason) {
        metricsRegistry.recordPredictorFallback(reason);
        return RiskAssessment.of(FallbackRiskHeuristic.score(features), threshold, true);
    }
}
