package com.geoinsight.mcp.exception;

/**
 * Stable error codes surfaced to the adapter layer.
 */
public enum ErrorCode {
    INVALID_ARGUMENT,
    UPSTREAM_UNAVAILABLE,
    INTERNAL
}
