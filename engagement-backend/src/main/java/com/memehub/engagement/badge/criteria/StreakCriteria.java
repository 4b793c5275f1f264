package com.memehub.engagement.badge.criteria;

import com.memehub.engagement.badge.BadgeCriteria;
import com.memehub.engagement.badge.UserStatistics;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * login_streak >= days
 */
@Getter
@EqualsAndHashCode
public class StreakCriteria implements BadgeCriteria {

    public static final String DESCRIPTOR_NAME = "login_streak";

    private final int days;

    public StreakCriteria(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Streak length must be at least 1: " + days);
        }
        this.days = days;
    }

    @Override
    public boolean isSatisfiedBy(UserStatistics statistics) {
        return statistics.getLoginStreak() >= days;
    }

    @Override
    public String describe() {
        return DESCRIPTOR_NAME + " >= " + days;
    }
}
