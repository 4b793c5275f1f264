package com.memehub.engagement.service;

import com.memehub.engagement.dto.BadgeDTO;
import com.memehub.engagement.dto.BadgeStatsDTO;

import java.util.List;

public interface BadgeService {
    List<BadgeStatsDTO> getBadgeList();
    List<BadgeStatsDTO> getBadgeRanking(Integer count, String sortOrder);
    List<BadgeDTO> userBadges(Long userId);

    /**
     * Percentage of the catalogue a user holds, 0-100 with one decimal.
     */
    double completionPercentage(Long userId);
}
