package com.market.pulse.enricher.common.exception;

/**
 * Exception thrown when an inbound bus payload cannot be turned into a market event.
 */
public class MalformedEventException extends BaseSignalException {
    private static final String DEFAULT_ERROR_CODE = "ERR-EVT-001";

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
