package net.cratedigger.service.provider;

import java.util.Objects;

/**
 * Thrown when a provider cannot produce candidates for a batch.
 */
public class RecommendationProviderException extends RuntimeException {

    /**
     * Failure categories reported by providers.
     */
    public enum ErrorCode {
        NOT_CONFIGURED,
        REQUEST_FAILED,
        MALFORMED_RESPONSE,
        RATE_LIMITED,
        CIRCUIT_OPEN
    }

    private final ErrorCode errorCode;

    public RecommendationProviderException(String message) {
        this(ErrorCode.REQUEST_FAILED, message, null);
    }

    public RecommendationProviderException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public RecommendationProviderException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
