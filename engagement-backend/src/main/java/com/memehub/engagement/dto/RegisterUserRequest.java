package com.memehub.engagement.dto;

import lombok.Data;

@Data
public class RegisterUserRequest {
    private Long userId;
    private String displayName;
}
