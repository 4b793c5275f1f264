package com.memehub.engagement.exception;

public class InvalidReferenceException extends EngagementException {

    public static final String UNKNOWN_USER = "UNKNOWN_USER";
    public static final String UNKNOWN_MEME = "UNKNOWN_MEME";
    public static final String INVALID_PARENT = "INVALID_PARENT";
    public static final String NOT_LIKED = "NOT_LIKED";

    public InvalidReferenceException(String reason, String message) {
        super(ErrorType.INVALID_REFERENCE, reason, message);
    }
}
