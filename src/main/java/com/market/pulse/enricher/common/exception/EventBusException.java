package com.market.pulse.enricher.common.exception;

/**
 * Thrown when the event bus cannot be reached.
 * Only raised at startup; publish failures at runtime travel as a failed Result.
 */
public class EventBusException extends BaseSignalException {
    public static final String DEFAULT_ERROR_CODE = "ERR-BUS-001";

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
