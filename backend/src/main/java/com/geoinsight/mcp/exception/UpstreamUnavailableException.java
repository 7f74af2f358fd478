package com.geoinsight.mcp.exception;

/**
 * An external collaborator (translator, embedding service, fact store scan) could not answer
 * in time or at all. Always retryable.
 */
public class UpstreamUnavailableException extends InsightException {

    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, true);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, true, cause);
    }
}
