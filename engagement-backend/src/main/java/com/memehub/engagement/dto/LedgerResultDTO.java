package com.memehub.engagement.dto;

import com.memehub.engagement.service.LedgerResult;
import lombok.Data;

/**
 * Result of a login or bonus. applied=false means the key was already recorded.
 */
@Data
public class LedgerResultDTO {
    private Boolean applied;
    private PointTransactionDTO transaction;
    private Long totalPoints;
    private String rank;
    private Boolean rankChanged;

    public static LedgerResultDTO from(LedgerResult result) {
        LedgerResultDTO dto = new LedgerResultDTO();
        dto.setApplied(result.isApplied());
        dto.setTransaction(PointTransactionDTO.from(result.getTransaction()));
        dto.setTotalPoints(result.getTotalPoints());
        dto.setRank(result.getRank().getDisplayName());
        dto.setRankChanged(result.isRankChanged());
        return dto;
    }
}
