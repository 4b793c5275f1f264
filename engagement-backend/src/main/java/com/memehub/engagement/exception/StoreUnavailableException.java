package com.memehub.engagement.exception;

public class StoreUnavailableException extends EngagementException {

    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorType.STORE_UNAVAILABLE, STORE_UNAVAILABLE, message, cause);
    }
}
