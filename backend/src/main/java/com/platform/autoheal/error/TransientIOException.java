package com.platform.autoheal.error;

/**
 * A collaborator (metrics backend, inference service, Kubernetes API) could not be reached
 * or answered with a retryable status.
 */
public class TransientIOException extends AutoHealException {

    public TransientIOException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransientIOException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static TransientIOException metrics(String message, Throwable cause) {
        return new TransientIOException(ErrorCode.METRICS_UNAVAILABLE, message, cause);
    }

    public static TransientIOException predictor(String message, Throwable cause) {
        return new TransientIOException(ErrorCode.PREDICTOR_UNAVAILABLE, message, cause);
    }

    public static TransientIOException kubernetes(String message, Throwable cause) {
        return new TransientIOException(ErrorCode.KUBERNETES_ERROR, message, cause);
    }
}
