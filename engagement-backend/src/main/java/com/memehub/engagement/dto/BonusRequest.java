package com.memehub.engagement.dto;

import lombok.Data;

@Data
public class BonusRequest {
    private Integer amount;
    /** caller-side key; the same key never pays twice */
    private String idempotencyKey;
    private String note;
}
