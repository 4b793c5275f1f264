package com.memehub.engagement.exception;

public enum ErrorType {
    DUPLICATE_ACTION,
    INVALID_REFERENCE,
    POLICY_VIOLATION,
    STORE_UNAVAILABLE
}
