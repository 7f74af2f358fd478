package com.geoinsight.mcp.exception;

/**
 * An invariant of the fact snapshot or the derived collections was violated,
 * e.g. two rows sharing one primary key. Fatal for the current request; data is never corrected.
 */
public class InternalInvariantException extends InsightException {

    public InternalInvariantException(String message) {
        super(ErrorCode.INTERNAL, message, false);
    }
}
