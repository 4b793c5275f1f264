package com.memehub.engagement.controller;

import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.exception.EngagementException;
import com.memehub.engagement.exception.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一异常处理: engine errors -> HTTP status + CommonResponse.error(code, message, reason)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EngagementException.class)
    public ResponseEntity<CommonResponse<String>> handleEngagementException(EngagementException ex) {
        HttpStatus status = statusOf(ex.getType());
        if (ex.isRetryable()) {
            log.warn("Store unavailable: {}", ex.getMessage());
            // 不把底层数据库异常信息返回给调用方
            return ResponseEntity.status(status)
                    .header(HttpHeaders.RETRY_AFTER, "1")
                    .body(CommonResponse.error(status.value(), "Service temporarily unavailable, retry later", ex.getReason()));
        }
        log.debug("{} rejected ({}): {}", ex.getType(), ex.getReason(), ex.getMessage());
        return respond(status, ex.getMessage(), ex.getReason());
    }

    @ExceptionHandler({IllegalArgumentException.class,
                       MissingRequestHeaderException.class,
                       MethodArgumentTypeMismatchException.class,
                       HttpMessageNotReadableException.class})
    public ResponseEntity<CommonResponse<String>> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<String>> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
    }

    private HttpStatus statusOf(ErrorType type) {
        switch (type) {
            case DUPLICATE_ACTION:
                return HttpStatus.CONFLICT;
            case INVALID_REFERENCE:
                return HttpStatus.NOT_FOUND;
            case POLICY_VIOLATION:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STORE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<CommonResponse<String>> respond(HttpStatus status, String message, String reason) {
        return ResponseEntity.status(status).body(CommonResponse.error(status.value(), message, reason));
    }
}
