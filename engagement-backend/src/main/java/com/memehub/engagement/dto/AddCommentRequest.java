package com.memehub.engagement.dto;

import lombok.Data;

@Data
public class AddCommentRequest {
    private String body;
    private Long parentCommentId;  // 可选
}
