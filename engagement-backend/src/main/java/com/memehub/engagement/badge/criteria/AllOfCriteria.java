package com.memehub.engagement.badge.criteria;

import com.memehub.engagement.badge.BadgeCriteria;
import com.memehub.engagement.badge.UserStatistics;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Composite AND: all(c1, c2, ...)
 */
@Getter
@EqualsAndHashCode
public class AllOfCriteria implements BadgeCriteria {

    private final List<BadgeCriteria> parts;

    public AllOfCriteria(List<BadgeCriteria> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("all() needs at least one criterion");
        }
        this.parts = List.copyOf(parts);
    }

    @Override
    public boolean isSatisfiedBy(UserStatistics statistics) {
        return parts.stream().allMatch(p -> p.isSatisfiedBy(statistics));
    }

    @Override
    public String describe() {
        return parts.stream()
                .map(BadgeCriteria::describe)
                .collect(Collectors.joining(", ", "all(", ")"));
    }
}
