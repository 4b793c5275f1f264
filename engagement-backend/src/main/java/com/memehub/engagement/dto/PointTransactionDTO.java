package com.memehub.engagement.dto;

import com.memehub.engagement.entity.PointTransaction;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class PointTransactionDTO {
    private Long transactionId;
    private Long userId;
    private Integer amount;
    private String reason;
    private String idempotencyKey;
    private String note;
    private LocalDateTime createdAt;

    public static PointTransactionDTO from(PointTransaction tx) {
        PointTransactionDTO dto = new PointTransactionDTO();
        dto.setTransactionId(tx.getTransactionId());
        dto.setUserId(tx.getUserId());
        dto.setAmount(tx.getAmount());
        dto.setReason(tx.getReason().name());
        dto.setIdempotencyKey(tx.getIdempotencyKey());
        dto.setNote(tx.getNote());
        dto.setCreatedAt(tx.getCreatedAt());
        return dto;
    }
}
