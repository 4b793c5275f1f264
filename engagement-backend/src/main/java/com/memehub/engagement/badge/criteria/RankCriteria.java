package com.memehub.engagement.badge.criteria;

import com.memehub.engagement.badge.BadgeCriteria;
import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.entity.Rank;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * rank >= RANK, e.g. "rank >= PRO_MEMER"
 */
@Getter
@EqualsAndHashCode
public class RankCriteria implements BadgeCriteria {

    public static final String DESCRIPTOR_NAME = "rank";

    private final Rank minimum;

    public RankCriteria(Rank minimum) {
        this.minimum = minimum;
    }

    @Override
    public boolean isSatisfiedBy(UserStatistics statistics) {
        return statistics.getRank() != null && statistics.getRank().isAtLeast(minimum);
    }

    @Override
    public String describe() {
        return DESCRIPTOR_NAME + " >= " + minimum.name();
    }
}
