package com.geoinsight.mcp.exception;

/**
 * Client input rejected before the fact store is touched
 * (malformed period, out-of-range threshold or top-K, unknown domain/metric/level).
 */
public class InvalidArgumentException extends InsightException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message, false);
    }
}
