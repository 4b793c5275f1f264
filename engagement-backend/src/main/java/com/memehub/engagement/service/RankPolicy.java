package com.memehub.engagement.service;

import com.memehub.engagement.dto.LevelDTO;
import com.memehub.engagement.dto.RankProgressDTO;
import com.memehub.engagement.entity.Rank;
import org.springframework.stereotype.Component;

/**
 * 等级算法组件：rank, next-rank progress and level as pure functions of points.
 *
 * Rank is a step function over {@link Rank} thresholds; a total exactly on a
 * threshold gets the higher rank.
 */
@Component
public class RankPolicy {

    private static final int POINTS_PER_LEVEL = 100;

    public Rank rankFor(long points) {
        Rank result = Rank.NEWBIE;
        for (Rank rank : Rank.values()) {
            if (points >= rank.getMinPoints()) {
                result = rank;
            }
        }
        return result;
    }

    public RankProgressDTO progress(long points) {
        Rank current = rankFor(points);
        RankProgressDTO dto = new RankProgressDTO();
        dto.setCurrentRank(current.getDisplayName());
        dto.setCurrentMin(current.getMinPoints());
        dto.setCurrentPoints(points);

        int nextOrdinal = current.ordinal() + 1;
        if (nextOrdinal < Rank.values().length) {
            Rank next = Rank.values()[nextOrdinal];
            dto.setNextRank(next.getDisplayName());
            dto.setNextThreshold(next.getMinPoints());
            dto.setPointsNeeded(next.getMinPoints() - points);
        }
        return dto;
    }

    /**
     * Every 100 points is one level, starting at level 1.
     */
    public LevelDTO level(long points) {
        long clamped = Math.max(0, points);
        int level = (int) (clamped / POINTS_PER_LEVEL) + 1;
        int inLevel = (int) (clamped % POINTS_PER_LEVEL);
        double progress = inLevel * 100.0 / POINTS_PER_LEVEL;
        return new LevelDTO(level, inLevel, POINTS_PER_LEVEL - inLevel, progress);
    }
}
