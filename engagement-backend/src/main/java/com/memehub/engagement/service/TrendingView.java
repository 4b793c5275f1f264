package com.memehub.engagement.service;

import com.memehub.engagement.dto.TrendingScoreDTO;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable trending snapshot for the window (windowStart, windowEnd].
 * Scores are already ordered by score desc, meme id asc.
 */
@Getter
@ToString
public class TrendingView {

    private final LocalDateTime windowStart;
    private final LocalDateTime windowEnd;
    private final LocalDateTime computedAt;
    private final List<TrendingScoreDTO> scores;

    public TrendingView(LocalDateTime windowStart, LocalDateTime windowEnd, LocalDateTime computedAt,
                        List<TrendingScoreDTO> scores) {
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.computedAt = computedAt;
        this.scores = List.copyOf(scores);
    }

    public static TrendingView empty(LocalDateTime now) {
        return new TrendingView(now, now, now, List.of());
    }

    public List<TrendingScoreDTO> top(int count) {
        if (count >= scores.size()) {
            return scores;
        }
        return scores.subList(0, Math.max(count, 0));
    }
}
