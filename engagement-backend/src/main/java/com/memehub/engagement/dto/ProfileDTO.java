package com.memehub.engagement.dto;

import lombok.Data;

import java.util.List;

@Data
public class ProfileDTO {
    private UserDTO user;
    private Long memesCreated;
    private Long likesReceived;
    private Long commentsMade;
    private Integer loginStreak;
    private RankProgressDTO rankProgress;
    private LevelDTO level;
    private List<MilestoneProgressDTO> milestones;
    private List<BadgeDTO> badges;
    private Double badgeCompletion;    // percentage of the catalogue held
    private Integer leaderboardPosition;
}
