package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 排行榜条目. Derived on read, never stored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryDTO {
    // 排名（从1开始）
    private Integer position;
    private Long userId;
    private String displayName;
    private Long totalPoints;
    private String rank;
}
