package com.memehub.engagement.service;

import com.memehub.engagement.entity.PointReason;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A point-affecting event handed to {@link PointsLedgerService#record(PointEvent)}.
 */
@Getter
@ToString
@AllArgsConstructor
public class PointEvent {

    private final Long userId;
    private final PointReason reason;
    private final int amount;
    private final String idempotencyKey;
    private final String note;

    public static PointEvent of(Long userId, PointReason reason, int amount, String idempotencyKey) {
        return new PointEvent(userId, reason, amount, idempotencyKey, null);
    }
}
