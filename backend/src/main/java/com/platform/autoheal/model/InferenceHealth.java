package com.platform.autoheal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health document served by the inference service at {@code GET /healthz}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InferenceHealth(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("status") String status,
    @JsonProperty("model_loaded") boolean modelLoaded,
    @JsonProperty("model_error") String modelError,
    @JsonProperty("model_path") String modelPath,
    @JsonProperty("model_path_exists") boolean modelPathExists
) {

    public static InferenceHealth unreachable(String reason) {
        return new InferenceHealth(false, "unreachable", false, reason, null, false);
    }

    public boolean isServing() {
        return ok && modelLoaded;
    }
}
