package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemeStatsDTO {
    private Long memeId;
    private Integer likeCount;
    private Integer commentCount;
    private Integer totalEngagement;  // likes + comments
}
