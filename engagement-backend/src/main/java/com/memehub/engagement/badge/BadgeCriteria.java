package com.memehub.engagement.badge;

/**
 * 徽章规则接口。A pure predicate over a statistics snapshot.
 * Implementations live in the criteria package and are built from
 * descriptor strings by {@link BadgeCriteriaParser}; a new kind of rule is a
 * new implementation there, not a branch in the evaluator.
 */
public interface BadgeCriteria {

    boolean isSatisfiedBy(UserStatistics statistics);

    /**
     * Canonical descriptor, parseable back into an equal criterion.
     */
    String describe();
}
