// File: com/memehub/engagement/dto/CommonResponse.java
package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 通用API响应结构 DTO
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 状态码：200, 400, 404, 409, 422, 500, 503
    private Integer code;

    private String message;

    // 业务数据; for errors this carries the reason code (e.g. ALREADY_LIKED)
    private T data;

    // 响应时间戳 (ms)
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(
                200,
                "OK",
                data,
                Instant.now().toEpochMilli()
        );
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    /**
     * 构造失败响应
     * @param code 状态码 (如 409, 503)
     * @param message 错误描述
     * @param reason machine-readable reason code, may be null
     */
    public static <T> CommonResponse<T> error(Integer code, String message, T reason) {
        return new CommonResponse<>(
                code,
                message,
                reason,
                Instant.now().toEpochMilli()
        );
    }

    public static <T> CommonResponse<T> error(Integer code, String message) {
        return error(code, message, null);
    }
}
