package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendingScoreDTO {
    private Long memeId;
    private Long ownerId;
    private Long likes;       // likes inside the window
    private Long comments;    // comments inside the window
    private Long score;       // likes * likeWeight + comments * commentWeight
}
