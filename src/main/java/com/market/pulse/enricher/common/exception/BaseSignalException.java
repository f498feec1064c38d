package com.market.pulse.enricher.common.exception;

import lombok.Getter;

/**
 * Base exception class for all pipeline exceptions.
 * Carries a stable error code alongside the message.
 */
@Getter
public abstract class BaseSignalException extends RuntimeException {
    /**
     * -- GETTER --
     *  Returns the error code associated with this exception.
     */
    private final String errorCode;

    public BaseSignalException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    public BaseSignalException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    public BaseSignalException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
