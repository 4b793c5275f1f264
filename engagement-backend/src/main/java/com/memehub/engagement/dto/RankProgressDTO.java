package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a user stands between the current rank and the next one.
 * nextRank, nextThreshold and pointsNeeded are null at the top rank.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankProgressDTO {
    private String currentRank;
    private Long currentMin;
    private Long currentPoints;
    private String nextRank;
    private Long nextThreshold;
    private Long pointsNeeded;
}
