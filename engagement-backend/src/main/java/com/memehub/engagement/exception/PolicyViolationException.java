package com.memehub.engagement.exception;

public class PolicyViolationException extends EngagementException {

    public static final String SELF_LIKE = "SELF_LIKE";
    public static final String EMPTY_BODY = "EMPTY_BODY";
    public static final String BODY_TOO_LONG = "BODY_TOO_LONG";
    public static final String BONUS_OUT_OF_RANGE = "BONUS_OUT_OF_RANGE";
    public static final String EMPTY_CONTENT = "EMPTY_CONTENT";
    public static final String CONTENT_TOO_LONG = "CONTENT_TOO_LONG";
    public static final String NAME_TOO_LONG = "NAME_TOO_LONG";
    public static final String KEY_TOO_LONG = "KEY_TOO_LONG";
    public static final String NOTE_TOO_LONG = "NOTE_TOO_LONG";

    public PolicyViolationException(String reason, String message) {
        super(ErrorType.POLICY_VIOLATION, reason, message);
    }
}
