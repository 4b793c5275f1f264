package com.memehub.engagement.service;

import com.memehub.engagement.dto.LeaderboardEntryDTO;

import java.util.List;

public interface LeaderboardService {
    List<LeaderboardEntryDTO> topByPoints(Integer count, Integer offset);

    /**
     * @return 1-based position of the user on the leaderboard
     */
    int positionOf(Long userId);
}
