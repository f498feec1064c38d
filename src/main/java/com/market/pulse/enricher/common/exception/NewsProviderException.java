package com.market.pulse.enricher.common.exception;

/**
 * Exception raised inside the news client when the provider call fails.
 * Never leaves the client: it is converted to a failed Result at the boundary.
 */
public class NewsProviderException extends BaseSignalException {
    public static final String TRANSPORT = "ERR-NEWS-001";
    public static final String BAD_STATUS = "ERR-NEWS-002";
    public static final String BAD_BODY = "ERR-NEWS-003";

    public NewsProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public NewsProviderException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    public NewsProviderException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return TRANSPORT;
    }
}
