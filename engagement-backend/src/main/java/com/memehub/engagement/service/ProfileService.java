package com.memehub.engagement.service;

import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.dto.ProfileDTO;
import com.memehub.engagement.dto.UserDTO;
import com.memehub.engagement.entity.AppUser;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 用户主页：积分、等级、下一等级进度、里程碑、统计数据与徽章
 */
@Service
@Transactional(readOnly = true)
public class ProfileService {

    private final UserService userService;
    private final UserStatisticsService statisticsService;
    private final RankPolicy rankPolicy;
    private final MilestonePolicy milestonePolicy;
    private final BadgeService badgeService;
    private final LeaderboardService leaderboardService;

    public ProfileService(UserService userService,
                          UserStatisticsService statisticsService,
                          RankPolicy rankPolicy,
                          MilestonePolicy milestonePolicy,
                          BadgeService badgeService,
                          LeaderboardService leaderboardService) {
        this.userService = userService;
        this.statisticsService = statisticsService;
        this.rankPolicy = rankPolicy;
        this.milestonePolicy = milestonePolicy;
        this.badgeService = badgeService;
        this.leaderboardService = leaderboardService;
    }

    public ProfileDTO profile(Long userId) {
        AppUser user = userService.requireUser(userId);
        UserStatistics statistics = statisticsService.snapshot(userId);
        long points = user.getTotalPoints();

        ProfileDTO dto = new ProfileDTO();
        dto.setUser(UserDTO.from(user));
        dto.setMemesCreated(statistics.getMemesCreated());
        dto.setLikesReceived(statistics.getLikesReceived());
        dto.setCommentsMade(statistics.getCommentsMade());
        dto.setLoginStreak(statistics.getLoginStreak());
        dto.setRankProgress(rankPolicy.progress(points));
        dto.setLevel(rankPolicy.level(points));
        dto.setMilestones(milestonePolicy.progress(statistics));
        dto.setBadges(badgeService.userBadges(userId));
        dto.setBadgeCompletion(badgeService.completionPercentage(userId));
        dto.setLeaderboardPosition(leaderboardService.positionOf(userId));
        return dto;
    }
}
