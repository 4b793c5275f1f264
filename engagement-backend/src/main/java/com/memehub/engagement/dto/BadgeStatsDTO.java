package com.memehub.engagement.dto;

import lombok.Data;

@Data
public class BadgeStatsDTO {
    private Integer rank;              // 排名 (仅用于排名列表)
    private String badgeKey;
    private String name;
    private String description;
    private String category;
    private Double completionRate;     // holders / users (0-1)
    private Integer holderCount;
}
