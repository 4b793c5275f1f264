package com.memehub.engagement.badge;

import com.memehub.engagement.entity.Rank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only snapshot of the counters badge criteria are evaluated against.
 */
@Getter
@ToString
@AllArgsConstructor
public class UserStatistics {

    private final Long userId;
    private final long memesCreated;
    private final long likesReceived;
    private final long commentsMade;
    private final int loginStreak;
    private final long totalPoints;
    private final Rank rank;

    public long valueOf(Counter counter) {
        switch (counter) {
            case MEMES_CREATED:
                return memesCreated;
            case LIKES_RECEIVED:
                return likesReceived;
            case COMMENTS_MADE:
                return commentsMade;
            case TOTAL_POINTS:
                return totalPoints;
            default:
                throw new IllegalArgumentException("Unsupported counter: " + counter);
        }
    }
}
