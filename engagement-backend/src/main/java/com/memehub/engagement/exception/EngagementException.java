package com.memehub.engagement.exception;

/**
 * Base of every named error the engine returns to its callers.
 * reason is a stable code such as ALREADY_LIKED or INVALID_PARENT.
 */
public abstract class EngagementException extends RuntimeException {

    private final ErrorType type;
    private final String reason;

    protected EngagementException(ErrorType type, String reason, String message) {
        super(message);
        this.type = type;
        this.reason = reason;
    }

    protected EngagementException(ErrorType type, String reason, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.reason = reason;
    }

    public ErrorType getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    /** Only infrastructure failures are worth retrying with the same key. */
    public boolean isRetryable() {
        return type == ErrorType.STORE_UNAVAILABLE;
    }
}
