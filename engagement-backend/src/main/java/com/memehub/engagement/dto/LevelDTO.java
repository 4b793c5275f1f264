package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Level = points / 100 + 1
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LevelDTO {
    private Integer level;
    private Integer pointsInLevel;
    private Integer pointsToNext;
    private Double progressPercentage;
}
