package com.platform.autoheal.predictor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response of {@code POST /predict}. Fields are nullable so that a malformed answer can be
 * detected instead of failing deserialization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PredictResponse(
    @JsonProperty("probability") Double probability,
    @JsonProperty("risk") String risk,
    @JsonProperty("features") Map<String, Object> features,
    @JsonProperty("model_loaded") Boolean modelLoaded,
    @JsonProperty("model_error") String modelError
) {

    /**
     * Why this response cannot be used, or null if it can.
     */
    public String malformedReason() {
        if (Boolean.FALSE.equals(modelLoaded)) {
            return "model not loaded" + (modelError != null ? ": " + modelError : "");
        }
        if (probability == null) {
            return "missing probability";
        }
        if (probability.isNaN() || probability < 0.0 || probability > 1.0) {
            return "probability out of range: " + probability;
        }
        return null;
    }
}
