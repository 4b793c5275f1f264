package com.memehub.engagement.badge.criteria;

import com.memehub.engagement.badge.BadgeCriteria;
import com.memehub.engagement.badge.Counter;
import com.memehub.engagement.badge.UserStatistics;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * counter >= minimum, e.g. "memes_created >= 5"
 */
@Getter
@EqualsAndHashCode
public class ThresholdCriteria implements BadgeCriteria {

    private final Counter counter;
    private final long minimum;

    public ThresholdCriteria(Counter counter, long minimum) {
        if (minimum < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + minimum);
        }
        this.counter = counter;
        this.minimum = minimum;
    }

    @Override
    public boolean isSatisfiedBy(UserStatistics statistics) {
        return statistics.valueOf(counter) >= minimum;
    }

    @Override
    public String describe() {
        return counter.getDescriptorName() + " >= " + minimum;
    }
}
