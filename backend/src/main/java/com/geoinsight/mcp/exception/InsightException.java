package com.geoinsight.mcp.exception;

import lombok.Getter;

/**
 * Base type for request-level failures of the insight engine.
 * Data-quality gaps (unresolvable spatial keys, too few observations) are never
 * reported through this hierarchy; they show up as empty fields in the payload.
 */
@Getter
public class InsightException extends RuntimeException {

    private final ErrorCode errorCode;
    private final boolean retryable;

    public InsightException(ErrorCode errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public InsightException(ErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
