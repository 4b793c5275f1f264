package com.memehub.engagement.dto;

import lombok.Data;

/**
 * 创作者数据: totals over all memes a user created.
 */
@Data
public class CreatorAnalyticsDTO {

    public enum Trend { UP, DOWN, STABLE }

    private Long userId;
    private Integer totalMemes;
    private Long totalLikes;
    private Long totalComments;
    private Double averageLikes;   // likes per meme, one decimal
    private MemeDTO bestMeme;     // most liked, newest wins a tie; null without memes
    private Trend engagementTrend;
}
