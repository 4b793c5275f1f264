package com.memehub.engagement.exception;

public class DuplicateActionException extends EngagementException {

    public static final String ALREADY_LIKED = "ALREADY_LIKED";
    public static final String DUPLICATE_KEY = "DUPLICATE_KEY";

    public DuplicateActionException(String reason, String message) {
        super(ErrorType.DUPLICATE_ACTION, reason, message);
    }

    public DuplicateActionException(String reason, String message, Throwable cause) {
        super(ErrorType.DUPLICATE_ACTION, reason, message, cause);
    }
}
