package com.memehub.engagement.service;

import com.memehub.engagement.entity.PointTransaction;
import com.memehub.engagement.entity.Rank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of recording a point event. applied is false when the
 * idempotency key had already been recorded and nothing changed.
 */
@Getter
@ToString
@AllArgsConstructor
public class LedgerResult {

    private final PointTransaction transaction;
    private final boolean applied;
    private final Rank previousRank;
    private final Rank rank;
    private final long totalPoints;

    public boolean isRankChanged() {
        return previousRank != rank;
    }
}
