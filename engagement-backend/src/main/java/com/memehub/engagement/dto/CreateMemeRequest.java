package com.memehub.engagement.dto;

import lombok.Data;

@Data
public class CreateMemeRequest {
    private String contentRef;
}
