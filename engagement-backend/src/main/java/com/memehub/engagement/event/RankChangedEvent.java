package com.memehub.engagement.event;

import com.memehub.engagement.entity.Rank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RankChangedEvent {

    private final Long userId;
    private final Rank previousRank;
    private final Rank newRank;
    private final long totalPoints;
}
